package io.github.hotbrkm.mailrouter.engine.email.tenant;

import io.github.hotbrkm.mailrouter.engine.email.domain.EmailAddressUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the required fields of each provider variant before a configuration is persisted.
 */
public class TenantConfigValidator {

    public void validate(TenantEmailConfig config) {
        List<String> violations = new ArrayList<>();
        if (config.tenantId().isBlank()) {
            violations.add("Tenant id is required");
        }

        switch (config.providerKind()) {
            case SENDGRID -> validateSendGrid((SendGridConfig) config.providerConfig(), violations);
            case SMTP -> validateSmtp("SMTP configuration", (SmtpConfig) config.providerConfig(), violations);
        }
        if (config.fallbackSmtp() != null) {
            validateSmtp("Fallback SMTP configuration", config.fallbackSmtp(), violations);
        }

        if (!violations.isEmpty()) {
            throw new ConfigurationException(config.tenantId(), violations);
        }
    }

    private void validateSendGrid(SendGridConfig sendGrid, List<String> violations) {
        if (isBlank(sendGrid.apiKey())) {
            violations.add("SendGrid configuration requires API key");
        }
        if (isBlank(sendGrid.fromEmail())) {
            violations.add("SendGrid configuration requires from email");
        } else if (!EmailAddressUtil.isValidAddress(sendGrid.fromEmail())) {
            violations.add("SendGrid configuration has invalid from email: " + sendGrid.fromEmail());
        }
    }

    private void validateSmtp(String label, SmtpConfig smtp, List<String> violations) {
        if (isBlank(smtp.host())) {
            violations.add(label + " requires host");
        }
        if (smtp.port() <= 0 || smtp.port() > 65535) {
            violations.add(label + " requires port");
        }
        if (isBlank(smtp.username())) {
            violations.add(label + " requires username");
        }
        if (isBlank(smtp.password())) {
            violations.add(label + " requires password");
        }
        if (isBlank(smtp.fromEmail())) {
            violations.add(label + " requires fromEmail");
        } else if (!EmailAddressUtil.isValidAddress(smtp.fromEmail())) {
            violations.add(label + " has invalid fromEmail: " + smtp.fromEmail());
        }
        // 0 leaves a limit unset; DeliveryProperties.Smtp resolves it to the engine default
        if (smtp.maxConnections() < 0 || smtp.maxMessages() < 0 || smtp.rateLimitPerMinute() < 0) {
            violations.add(label + " pool limits must not be negative");
        }
        if (smtp.connectionTimeout() < 0 || smtp.socketTimeout() < 0 || smtp.greetingTimeout() < 0) {
            violations.add(label + " timeouts must not be negative");
        }
        DkimSettings dkim = smtp.dkim();
        if (dkim != null && dkim.enabled() && !dkim.isUsable()) {
            violations.add(label + " enables DKIM without privateKey, selector and domain");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
