package io.github.hotbrkm.mailrouter.engine.email.tenant;

import lombok.Builder;

/**
 * SMTP relay settings. Pool and timeout values of {@code 0} fall back to the engine defaults
 * ({@code delivery.smtp.*}).
 */
@Builder(toBuilder = true)
public record SmtpConfig(String host,
                         int port,
                         boolean secure,
                         String username,
                         String password,
                         String fromEmail,
                         String fromName,
                         String replyTo,
                         DkimSettings dkim,
                         int maxConnections,
                         int maxMessages,
                         int rateLimitPerMinute,
                         int connectionTimeout,
                         int socketTimeout,
                         int greetingTimeout,
                         String staticIp,
                         boolean enableTls,
                         boolean requireTls) implements ProviderConfig {

    @Override
    public ProviderKind kind() {
        return ProviderKind.SMTP;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    public boolean isDkimEnabled() {
        return dkim != null && dkim.enabled();
    }

    public static class SmtpConfigBuilder {
        private int port = 587;
        private boolean enableTls = true;
    }
}
