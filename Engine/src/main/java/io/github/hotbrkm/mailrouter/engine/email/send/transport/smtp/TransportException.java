package io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp;

import io.github.hotbrkm.mailrouter.engine.email.EmailDeliveryException;
import lombok.Getter;

/**
 * The relay was unreachable or rejected the handshake or credentials while a session was being opened.
 */
@Getter
public class TransportException extends EmailDeliveryException {
    private final SmtpConnectionKey key;
    private final String originalMessage;

    public TransportException(SmtpConnectionKey key, String originalMessage, Throwable cause) {
        super("SMTP connection to " + key.host() + ":" + key.port() + " failed: " + originalMessage, cause);
        this.key = key;
        this.originalMessage = originalMessage;
    }
}
