package io.github.hotbrkm.mailrouter.engine.email.send.result;

public enum ProviderUsed {
    SENDGRID,
    SMTP,
    /**
     * No provider could be attempted.
     */
    NONE
}
