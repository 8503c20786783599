package io.github.hotbrkm.mailrouter.engine.email.tenant;

/**
 * HTTP API provider settings.
 */
public record SendGridConfig(String apiKey, String fromEmail, String fromName, String webhookUrl) implements ProviderConfig {

    /**
     * Key shipped in onboarding templates; never a usable credential.
     */
    public static final String PLACEHOLDER_API_KEY = "SG.your-actual-sendgrid-api-key";

    public SendGridConfig(String apiKey, String fromEmail, String fromName) {
        this(apiKey, fromEmail, fromName, null);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.SENDGRID;
    }

    public boolean hasUsableApiKey() {
        return apiKey != null && !apiKey.isBlank() && !PLACEHOLDER_API_KEY.equals(apiKey.trim());
    }
}
