package io.github.hotbrkm.mailrouter.engine.email.domain;

import io.github.hotbrkm.mailrouter.engine.email.EmailDeliveryException;
import lombok.Getter;

/**
 * Malformed recipient address, rejected before any network call.
 */
@Getter
public class ValidationException extends EmailDeliveryException {
    private final String recipient;

    public ValidationException(String recipient) {
        super("Invalid recipient address: " + recipient);
        this.recipient = recipient;
    }
}
