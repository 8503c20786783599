package io.github.hotbrkm.mailrouter.engine.email.tenant;

public enum ProviderKind {
    SENDGRID,
    SMTP
}
