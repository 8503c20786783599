package io.github.hotbrkm.mailrouter.engine.email.tenant;

import io.github.hotbrkm.mailrouter.engine.email.domain.EmailAddressUtil;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The active email provider configuration of one tenant.
 *
 * @param tenantId       owning tenant
 * @param providerConfig provider variant; its kind is the tenant's provider kind
 * @param fallbackSmtp   optional relay tried when the HTTP API provider fails, may be {@code null}
 * @param updatedAt      time of the last {@code configure}
 */
public record TenantEmailConfig(String tenantId, ProviderConfig providerConfig, SmtpConfig fallbackSmtp, Instant updatedAt) {

    public TenantEmailConfig {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(providerConfig, "providerConfig must not be null");
    }

    public static TenantEmailConfig sendGrid(String tenantId, SendGridConfig config) {
        return new TenantEmailConfig(tenantId, config, null, null);
    }

    public static TenantEmailConfig sendGrid(String tenantId, SendGridConfig config, SmtpConfig fallbackSmtp) {
        return new TenantEmailConfig(tenantId, config, fallbackSmtp, null);
    }

    public static TenantEmailConfig smtp(String tenantId, SmtpConfig config) {
        return new TenantEmailConfig(tenantId, config, null, null);
    }

    public ProviderKind providerKind() {
        return providerConfig.kind();
    }

    public Optional<SendGridConfig> sendGridConfig() {
        return providerConfig instanceof SendGridConfig sendGrid ? Optional.of(sendGrid) : Optional.empty();
    }

    /**
     * The SMTP relay available to this tenant: its primary config for SMTP tenants, else the registered fallback.
     */
    public Optional<SmtpConfig> smtpConfig() {
        if (providerConfig instanceof SmtpConfig smtp) {
            return Optional.of(smtp);
        }
        return Optional.ofNullable(fallbackSmtp);
    }

    public String fromEmail() {
        return providerConfig.fromEmail();
    }

    public String fromDomain() {
        return EmailAddressUtil.extractDomain(providerConfig.fromEmail());
    }

    public TenantEmailConfig withTenantId(String newTenantId) {
        return new TenantEmailConfig(newTenantId, providerConfig, fallbackSmtp, updatedAt);
    }

    public TenantEmailConfig withProviderConfig(ProviderConfig newProviderConfig) {
        return new TenantEmailConfig(tenantId, newProviderConfig, fallbackSmtp, updatedAt);
    }

    public TenantEmailConfig withUpdatedAt(Instant newUpdatedAt) {
        return new TenantEmailConfig(tenantId, providerConfig, fallbackSmtp, newUpdatedAt);
    }
}
