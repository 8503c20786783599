package io.github.hotbrkm.mailrouter.engine.email.tenant;

import io.github.hotbrkm.mailrouter.engine.email.EmailDeliveryException;
import lombok.Getter;

import java.util.List;

/**
 * Missing or invalid provider settings. Never retried.
 */
@Getter
public class ConfigurationException extends EmailDeliveryException {
    private final String tenantId;
    private final List<String> violations;

    public ConfigurationException(String tenantId, List<String> violations) {
        super(String.join("; ", violations));
        this.tenantId = tenantId;
        this.violations = List.copyOf(violations);
    }

    public ConfigurationException(String tenantId, String message) {
        this(tenantId, List.of(message));
    }

    public ConfigurationException(String tenantId, String message, Throwable cause) {
        super(message, cause);
        this.tenantId = tenantId;
        this.violations = List.of(message);
    }
}
