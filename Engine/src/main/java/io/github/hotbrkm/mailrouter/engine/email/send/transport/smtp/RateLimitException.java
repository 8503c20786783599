package io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp;

import io.github.hotbrkm.mailrouter.engine.email.EmailDeliveryException;
import lombok.Getter;

/**
 * Local admission denial: the key already sent {@code rateLimitPerMinute} messages in the trailing minute.
 */
@Getter
public class RateLimitException extends EmailDeliveryException {
    private final SmtpConnectionKey key;
    private final long waitMillis;

    public RateLimitException(SmtpConnectionKey key, long waitMillis) {
        super("Rate limit exceeded. Wait " + (long) Math.ceil(waitMillis / 1000d) + " seconds.");
        this.key = key;
        this.waitMillis = waitMillis;
    }
}
