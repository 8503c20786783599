package io.github.hotbrkm.mailrouter.engine.email.config;

import io.github.hotbrkm.mailrouter.engine.email.tenant.SmtpConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Engine-wide settings bound from {@code delivery.*}.
 *
 * <pre>
 * delivery:
 *   mailer: MailRouter/1.0
 *   presend-domain-check: true
 *   smtp:
 *     max-connections: 5
 *     rate-limit-per-minute: 10
 *   dns:
 *     servers: [8.8.8.8, 1.1.1.1]
 *   fallback-smtp:
 *     host: relay.example.com
 *     port: 587
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "delivery")
public class DeliveryProperties {

    public static final String DEFAULT_MAILER = "MailRouter/1.0";

    private String mailer = DEFAULT_MAILER;
    private boolean presendDomainCheck = true;

    private Smtp smtp = new Smtp();
    private Dns dns = new Dns();
    private Blacklist blacklist = new Blacklist();
    private Scoring scoring = new Scoring();
    private FallbackSmtp fallbackSmtp = new FallbackSmtp();

    /**
     * Defaults applied to tenant SMTP configurations that leave pool settings unset.
     */
    @Data
    public static class Smtp {
        public static final int DEFAULT_MAX_CONNECTIONS = 5;
        public static final int DEFAULT_MAX_MESSAGES = 100;
        public static final int DEFAULT_RATE_LIMIT_PER_MINUTE = 10;
        public static final int DEFAULT_CONNECTION_TIMEOUT_MS = 60_000;
        public static final int DEFAULT_SOCKET_TIMEOUT_MS = 60_000;
        public static final int DEFAULT_GREETING_TIMEOUT_MS = 30_000;

        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private int maxMessages = DEFAULT_MAX_MESSAGES;
        private int rateLimitPerMinute = DEFAULT_RATE_LIMIT_PER_MINUTE;
        private int connectionTimeout = DEFAULT_CONNECTION_TIMEOUT_MS;
        private int socketTimeout = DEFAULT_SOCKET_TIMEOUT_MS;
        private int greetingTimeout = DEFAULT_GREETING_TIMEOUT_MS;
        private boolean smtpTrace;

        public int resolveMaxConnections(int value) {
            return value > 0 ? value : positiveOr(maxConnections, DEFAULT_MAX_CONNECTIONS);
        }

        public int resolveMaxMessages(int value) {
            return value > 0 ? value : positiveOr(maxMessages, DEFAULT_MAX_MESSAGES);
        }

        public int resolveRateLimitPerMinute(int value) {
            return value > 0 ? value : positiveOr(rateLimitPerMinute, DEFAULT_RATE_LIMIT_PER_MINUTE);
        }

        public int resolveConnectionTimeout(int value) {
            return value > 0 ? value : positiveOr(connectionTimeout, DEFAULT_CONNECTION_TIMEOUT_MS);
        }

        public int resolveSocketTimeout(int value) {
            return value > 0 ? value : positiveOr(socketTimeout, DEFAULT_SOCKET_TIMEOUT_MS);
        }

        public int resolveGreetingTimeout(int value) {
            return value > 0 ? value : positiveOr(greetingTimeout, DEFAULT_GREETING_TIMEOUT_MS);
        }

        private static int positiveOr(int value, int fallback) {
            return value > 0 ? value : fallback;
        }
    }

    @Data
    public static class Dns {
        public static final String DEFAULT_DKIM_SELECTOR = "default";

        // Empty means the system resolver configuration
        private List<String> servers = new ArrayList<>();
        private int timeoutMs = 5_000;
        private int retryCount = 2;
        private int lookupThreads = 8;
        private String defaultDkimSelector = DEFAULT_DKIM_SELECTOR;

        public String resolveDkimSelector(String selector) {
            if (selector != null && !selector.isBlank()) {
                return selector.trim();
            }
            return defaultDkimSelector == null || defaultDkimSelector.isBlank() ? DEFAULT_DKIM_SELECTOR : defaultDkimSelector;
        }
    }

    @Data
    public static class Blacklist {
        public static final List<String> DEFAULT_ZONES = List.of(
                "zen.spamhaus.org",
                "bl.spamcop.net",
                "dnsbl.sorbs.net",
                "cbl.abuseat.org",
                "pbl.spamhaus.org");

        private List<String> zones = new ArrayList<>(DEFAULT_ZONES);
    }

    /**
     * Weights and thresholds used by the reputation model.
     */
    @Data
    public static class Scoring {
        // SMTP connection reputation
        private double successRateWeight = 70;
        private double deliveryTimeWeight = 30;
        private int failurePenalty = 5;

        // Tenant reputation score
        private double deliveryWeight = 0.4;
        private double domainWeight = 0.3;
        private double complianceWeight = 0.3;
        private double bouncePenaltyFactor = 2;
        private double complaintPenaltyFactor = 5;

        private double bounceRecommendThreshold = 5;
        private double bounceCriticalThreshold = 10;
        private double complaintRecommendThreshold = 0.1;
        private double complaintCriticalThreshold = 0.5;
        private double deliveryRateRecommendThreshold = 95;

        private int baseVolume = 1000;
        private int warmupThreshold = 80;
        private int historyDays = 30;
    }

    /**
     * Platform relay used when a SendGrid tenant has no SMTP fallback of its own.
     */
    @Data
    public static class FallbackSmtp {
        private String host;
        private int port = 587;
        private boolean secure;
        private String username;
        private String password;
        private String fromEmail;
        private String fromName;
        private boolean enableTls = true;
        private boolean requireTls;

        public boolean isConfigured() {
            return host != null && !host.isBlank() && fromEmail != null && !fromEmail.isBlank();
        }

        public Optional<SmtpConfig> toSmtpConfig() {
            if (!isConfigured()) {
                return Optional.empty();
            }
            return Optional.of(SmtpConfig.builder()
                    .host(host.trim())
                    .port(port)
                    .secure(secure)
                    .username(username)
                    .password(password)
                    .fromEmail(fromEmail.trim())
                    .fromName(fromName)
                    .enableTls(enableTls)
                    .requireTls(requireTls)
                    .build());
        }
    }
}
