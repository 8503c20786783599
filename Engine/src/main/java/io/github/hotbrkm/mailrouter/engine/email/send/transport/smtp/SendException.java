package io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp;

import io.github.hotbrkm.mailrouter.engine.email.EmailDeliveryException;
import lombok.Getter;

/**
 * Per-message failure after a session was acquired: network error, rejected recipient, composition error.
 */
@Getter
public class SendException extends EmailDeliveryException {
    private final SmtpConnectionKey key;
    private final String recipient;

    public SendException(SmtpConnectionKey key, String recipient, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
        this.recipient = recipient;
    }
}
