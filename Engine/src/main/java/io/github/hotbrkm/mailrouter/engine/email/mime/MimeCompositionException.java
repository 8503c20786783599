package io.github.hotbrkm.mailrouter.engine.email.mime;

import io.github.hotbrkm.mailrouter.engine.email.EmailDeliveryException;

/**
 * The message could not be rendered or signed.
 */
public class MimeCompositionException extends EmailDeliveryException {

    public MimeCompositionException(String message, Throwable cause) {
        super(message, cause);
    }
}
