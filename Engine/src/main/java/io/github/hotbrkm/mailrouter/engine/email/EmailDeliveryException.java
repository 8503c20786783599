package io.github.hotbrkm.mailrouter.engine.email;

/**
 * Base type of the failures raised by the delivery engine.
 */
public class EmailDeliveryException extends RuntimeException {

    public EmailDeliveryException(String message) {
        super(message);
    }

    public EmailDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
