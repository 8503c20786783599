package io.github.hotbrkm.mailrouter.engine.email.send.routing;

import io.github.hotbrkm.mailrouter.engine.email.EmailDeliveryException;
import lombok.Getter;

/**
 * Every provider in the tenant's fallback chain was unusable.
 */
@Getter
public class NoProviderAvailableException extends EmailDeliveryException {
    private final String tenantId;
    private final String primaryError;

    public NoProviderAvailableException(String tenantId, String primaryError) {
        super(buildMessage(primaryError));
        this.tenantId = tenantId;
        this.primaryError = primaryError;
    }

    private static String buildMessage(String primaryError) {
        String message = "Neither SendGrid nor SMTP is properly configured.";
        return primaryError == null ? message : message + " SendGrid error: " + primaryError;
    }
}
