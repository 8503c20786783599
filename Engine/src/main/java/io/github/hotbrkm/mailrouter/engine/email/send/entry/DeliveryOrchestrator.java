package io.github.hotbrkm.mailrouter.engine.email.send.entry;

import io.github.hotbrkm.mailrouter.engine.email.dns.DkimKeyPair;
import io.github.hotbrkm.mailrouter.engine.email.dns.DkimKeyPairGenerator;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordType;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordValidation;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordValidator;
import io.github.hotbrkm.mailrouter.engine.email.dns.DomainSetupGuide;
import io.github.hotbrkm.mailrouter.engine.email.domain.EmailAddressUtil;
import io.github.hotbrkm.mailrouter.engine.email.domain.ValidationException;
import io.github.hotbrkm.mailrouter.engine.email.reputation.BlacklistMonitor;
import io.github.hotbrkm.mailrouter.engine.email.reputation.BlacklistStatus;
import io.github.hotbrkm.mailrouter.engine.email.reputation.DeliverabilityScorer;
import io.github.hotbrkm.mailrouter.engine.email.reputation.DeliveryOptimization;
import io.github.hotbrkm.mailrouter.engine.email.reputation.ReputationMetrics;
import io.github.hotbrkm.mailrouter.engine.email.send.SendRequest;
import io.github.hotbrkm.mailrouter.engine.email.send.metrics.DeliveryMetricsRecorder;
import io.github.hotbrkm.mailrouter.engine.email.send.result.DeliveryResult;
import io.github.hotbrkm.mailrouter.engine.email.send.result.ProviderUsed;
import io.github.hotbrkm.mailrouter.engine.email.send.routing.NoProviderAvailableException;
import io.github.hotbrkm.mailrouter.engine.email.send.routing.ProviderRouter;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.ConnectionStatsSnapshot;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.RateLimitException;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.SmtpConnectionKey;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.SmtpTransportPoolManager;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailRecord;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailRecordStore;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailStatus;
import io.github.hotbrkm.mailrouter.engine.email.tenant.ConfigurationException;
import io.github.hotbrkm.mailrouter.engine.email.tenant.DkimSettings;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SendGridConfig;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SmtpConfig;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantConfigStore;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantConfigValidator;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantEmailConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the engine: tenant configuration, sending and deliverability diagnostics.
 * <p>
 * A send runs: config lookup, recipient check, pre-send domain check, provider routing, record update.
 * Provider exhaustion and local rate limiting are returned as failed results; configuration and
 * recipient errors are thrown to the caller.
 */
@Slf4j
public class DeliveryOrchestrator {

    static final String TEST_EMAIL_SUBJECT = "Email Configuration Test";
    static final int MIN_DOMAIN_SCORE = 80;

    private final TenantConfigStore configStore;
    private final TenantConfigValidator configValidator;
    private final EmailRecordStore recordStore;
    private final ProviderRouter router;
    private final DnsRecordValidator dnsValidator;
    private final BlacklistMonitor blacklistMonitor;
    private final DeliverabilityScorer scorer;
    private final DkimKeyPairGenerator keyPairGenerator;
    private final SmtpTransportPoolManager poolManager;
    private final DeliveryMetricsRecorder metrics;
    private final boolean presendDomainCheck;
    private final Clock clock;

    public DeliveryOrchestrator(TenantConfigStore configStore,
                                TenantConfigValidator configValidator,
                                EmailRecordStore recordStore,
                                ProviderRouter router,
                                DnsRecordValidator dnsValidator,
                                BlacklistMonitor blacklistMonitor,
                                DeliverabilityScorer scorer,
                                DkimKeyPairGenerator keyPairGenerator,
                                SmtpTransportPoolManager poolManager,
                                DeliveryMetricsRecorder metrics,
                                boolean presendDomainCheck,
                                Clock clock) {
        this.configStore = Objects.requireNonNull(configStore, "configStore must not be null");
        this.configValidator = Objects.requireNonNull(configValidator, "configValidator must not be null");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.dnsValidator = Objects.requireNonNull(dnsValidator, "dnsValidator must not be null");
        this.blacklistMonitor = Objects.requireNonNull(blacklistMonitor, "blacklistMonitor must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.keyPairGenerator = Objects.requireNonNull(keyPairGenerator, "keyPairGenerator must not be null");
        this.poolManager = Objects.requireNonNull(poolManager, "poolManager must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.presendDomainCheck = presendDomainCheck;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Validates and stores the tenant's provider configuration, replacing any previous one.
     *
     * @throws ConfigurationException listing every violated requirement
     */
    public TenantEmailConfig configure(String tenantId, TenantEmailConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        TenantEmailConfig candidate = config.withTenantId(tenantId).withUpdatedAt(clock.instant());
        configValidator.validate(candidate);
        TenantEmailConfig saved = configStore.save(candidate);
        log.info("Email provider configured. tenantId={}, provider={}, fallbackSmtp={}", tenantId, saved.providerKind(),
                saved.fallbackSmtp() != null);
        return saved;
    }

    /**
     * @throws ConfigurationException when the tenant has no configuration
     * @throws ValidationException    when the recipient is malformed; the email record is marked failed first
     * @throws ConfigurationException when a provider cannot be built from the stored settings; the record is marked failed first
     */
    public DeliveryResult send(String tenantId, SendRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        TenantEmailConfig config = requireConfig(tenantId);
        EmailRecord record = trackRecord(tenantId, request);

        if (!EmailAddressUtil.isValidAddress(request.to())) {
            ValidationException e = new ValidationException(request.to());
            recordStore.markFailed(record.id(), e.getMessage());
            log.warn("Send rejected. tenantId={}, correlationId={}, message={}", tenantId, request.correlationId(), e.getMessage());
            throw e;
        }

        List<String> warnings = presendWarnings(config);
        DeliveryResult result;
        try {
            result = router.route(config, request);
        } catch (NoProviderAvailableException e) {
            result = DeliveryResult.failure(e.getMessage(), 0L, ProviderUsed.NONE);
            metrics.recordUnrouted();
        } catch (RateLimitException e) {
            result = DeliveryResult.rateLimited(e.getMessage(), e.getWaitMillis(), ProviderUsed.SMTP);
        } catch (ConfigurationException e) {
            recordStore.markFailed(record.id(), e.getMessage());
            log.warn("Email send failed. tenantId={}, provider={}, correlationId={}, error={}", tenantId, config.providerKind(),
                    request.correlationId(), e.getMessage());
            throw e;
        }
        result = result.withWarnings(warnings);

        if (result.success()) {
            recordStore.markSent(record.id(), result.providerUsed(), result.messageId(), clock.instant());
            log.info("Email sent. tenantId={}, provider={}, correlationId={}, messageId={}, deliveryTime={}ms", tenantId,
                    result.providerUsed(), request.correlationId(), result.messageId(), result.deliveryTimeMs());
        } else {
            recordStore.markFailed(record.id(), result.error());
            log.warn("Email send failed. tenantId={}, provider={}, correlationId={}, error={}", tenantId, result.providerUsed(),
                    request.correlationId(), result.error());
        }
        return result;
    }

    public DomainSetupGuide validateDomain(String domain, String smtpHost) {
        return dnsValidator.validateDomain(domain, smtpHost);
    }

    public ReputationMetrics getReputation(String tenantId) {
        return scorer.getReputation(tenantId);
    }

    public DeliveryOptimization analyzeDeliveryOptimization(String tenantId) {
        return scorer.analyzeDeliveryOptimization(tenantId);
    }

    public List<BlacklistStatus> checkBlacklist(String domain) {
        return blacklistMonitor.checkBlacklist(domain);
    }

    public DkimKeyPair generateDkimKeyPair() {
        return keyPairGenerator.generate();
    }

    /**
     * Generates a key pair for the tenant's from-domain and enables DKIM signing in its SMTP configuration.
     *
     * @throws ConfigurationException when the tenant is not configured for SMTP
     */
    public DkimKeyPair generateDkimKeyPair(String tenantId) {
        TenantEmailConfig config = requireConfig(tenantId);
        if (!(config.providerConfig() instanceof SmtpConfig smtp)) {
            throw new ConfigurationException(tenantId, "DKIM key generation requires an SMTP configuration");
        }

        String domain = config.fromDomain();
        DkimKeyPair keyPair = keyPairGenerator.generate(domain);
        SmtpConfig signed = smtp.toBuilder()
                .dkim(DkimSettings.builder()
                        .enabled(true)
                        .privateKey(keyPair.privateKey())
                        .selector(keyPair.selector())
                        .domain(domain)
                        .build())
                .build();
        configStore.save(config.withProviderConfig(signed).withUpdatedAt(clock.instant()));
        log.info("DKIM key generated. tenantId={}, domain={}, selector={}", tenantId, domain, keyPair.selector());
        return keyPair;
    }

    public EmailSetupReport validateEmailSetup(String tenantId) {
        TenantEmailConfig config = configStore.find(tenantId).orElse(null);
        if (config == null) {
            return new EmailSetupReport(false, null, List.of("No email provider configured"),
                    List.of("Configure an email provider (SendGrid or SMTP)"), null, clock.instant());
        }

        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        String smtpHost = null;
        if (config.providerConfig() instanceof SendGridConfig sendGrid) {
            if (!sendGrid.hasUsableApiKey()) {
                issues.add("SendGrid API key is missing or using placeholder value");
                recommendations.add("Add a valid SendGrid API key");
            }
        } else if (config.providerConfig() instanceof SmtpConfig smtp) {
            smtpHost = smtp.host();
            if (!smtp.hasCredentials()) {
                issues.add("SMTP configuration is incomplete");
                recommendations.add("Complete SMTP host, username, and password configuration");
            }
        }

        DomainSetupGuide guide = null;
        String domain = config.fromDomain();
        if (EmailAddressUtil.INVALID.equals(domain)) {
            issues.add("From email is not configured");
            recommendations.add("Configure a from email address");
        } else {
            guide = dnsValidator.validateDomain(domain, smtpHost);
            if (guide.overallScore() < MIN_DOMAIN_SCORE) {
                recommendations.add("Improve DNS configuration (score: " + guide.overallScore() + "/100)");
                issues.addAll(guide.issues());
            }
        }

        log.info("Email setup checked. tenantId={}, provider={}, issues={}", tenantId, config.providerKind(), issues.size());
        return new EmailSetupReport(issues.isEmpty(), config.providerKind(), issues, recommendations, guide, clock.instant());
    }

    /**
     * Sends a fixed test message through the normal routing path.
     */
    public DeliveryResult sendTestEmail(String tenantId, String to) {
        TenantEmailConfig config = requireConfig(tenantId);
        String content = "<h2>Email Configuration Test</h2>"
                + "<p>This is a test email to verify your email configuration.</p>"
                + "<p><strong>Provider:</strong> " + config.providerKind() + "</p>"
                + "<p><strong>Timestamp:</strong> " + clock.instant() + "</p>"
                + "<p>If you received this email, your configuration is working correctly!</p>";
        String correlationId = "test-" + UUID.randomUUID();
        return send(tenantId, new SendRequest(to, TEST_EMAIL_SUBJECT, content, correlationId));
    }

    public Map<SmtpConnectionKey, ConnectionStatsSnapshot> getConnectionStats() {
        return poolManager.getConnectionStats();
    }

    /**
     * SPF and DMARC presence of the from-domain. Lookup failures are logged and produce no warning.
     */
    List<String> presendWarnings(TenantEmailConfig config) {
        if (!presendDomainCheck) {
            return List.of();
        }
        String domain = config.fromDomain();
        if (EmailAddressUtil.INVALID.equals(domain)) {
            return List.of();
        }

        List<String> warnings = new ArrayList<>();
        try {
            CompletableFuture<DnsRecordValidation> spf = dnsValidator.validateAsync(DnsRecordType.SPF, domain, null, null);
            CompletableFuture<DnsRecordValidation> dmarc = dnsValidator.validateAsync(DnsRecordType.DMARC, domain, null, null);
            if (spf.join().issues().contains("No SPF record found")) {
                warnings.add("No SPF record found for domain " + domain + ". This may affect deliverability.");
            }
            if (dmarc.join().issues().contains("No DMARC record found")) {
                warnings.add("No DMARC record found for domain " + domain + ". Consider adding one for better reputation.");
            }
        } catch (RuntimeException e) {
            log.warn("Pre-send domain check failed. tenantId={}, domain={}, message={}", config.tenantId(), domain, e.getMessage());
        }
        return warnings;
    }

    private TenantEmailConfig requireConfig(String tenantId) {
        return configStore.find(tenantId)
                .orElseThrow(() -> new ConfigurationException(tenantId, "No email provider configured for tenant " + tenantId));
    }

    private EmailRecord trackRecord(String tenantId, SendRequest request) {
        return recordStore.findByCorrelationId(tenantId, request.correlationId())
                .orElseGet(() -> recordStore.save(EmailRecord.builder()
                        .id(UUID.randomUUID().toString())
                        .tenantId(tenantId)
                        .correlationId(request.correlationId())
                        .recipient(request.to())
                        .subject(request.subject())
                        .status(EmailStatus.SCHEDULED)
                        .createdAt(clock.instant())
                        .build()));
    }
}
