package io.github.hotbrkm.mailrouter.engine.email.tenant;

/**
 * Provider-specific settings of a tenant. Exactly one variant is stored per tenant.
 */
public sealed interface ProviderConfig permits SendGridConfig, SmtpConfig {

    ProviderKind kind();

    String fromEmail();

    String fromName();
}
