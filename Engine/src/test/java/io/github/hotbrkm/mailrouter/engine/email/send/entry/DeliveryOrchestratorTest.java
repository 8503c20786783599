package io.github.hotbrkm.mailrouter.engine.email.send.entry;

import io.github.hotbrkm.mailrouter.engine.email.config.DeliveryProperties;
import io.github.hotbrkm.mailrouter.engine.email.dns.DkimKeyPair;
import io.github.hotbrkm.mailrouter.engine.email.dns.DkimKeyPairGenerator;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordGenerator;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordValidator;
import io.github.hotbrkm.mailrouter.engine.email.dns.DomainSetupGuide;
import io.github.hotbrkm.mailrouter.engine.email.dns.TestDnsResolver;
import io.github.hotbrkm.mailrouter.engine.email.domain.ValidationException;
import io.github.hotbrkm.mailrouter.engine.email.reputation.BlacklistMonitor;
import io.github.hotbrkm.mailrouter.engine.email.reputation.DeliverabilityScorer;
import io.github.hotbrkm.mailrouter.engine.email.send.OutboundMessage;
import io.github.hotbrkm.mailrouter.engine.email.send.SendRequest;
import io.github.hotbrkm.mailrouter.engine.email.send.metrics.DeliveryMetricsRecorder;
import io.github.hotbrkm.mailrouter.engine.email.send.result.DeliveryResult;
import io.github.hotbrkm.mailrouter.engine.email.send.result.ProviderUsed;
import io.github.hotbrkm.mailrouter.engine.email.send.routing.ProviderRouter;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.api.SendGridApiClient;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.RateLimitException;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.SmtpConnectionKey;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.SmtpTransportPoolManager;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailRecord;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailStatus;
import io.github.hotbrkm.mailrouter.engine.email.store.InMemoryEmailRecordStore;
import io.github.hotbrkm.mailrouter.engine.email.tenant.ConfigurationException;
import io.github.hotbrkm.mailrouter.engine.email.tenant.InMemoryTenantConfigStore;
import io.github.hotbrkm.mailrouter.engine.email.tenant.ProviderKind;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SendGridConfig;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SmtpConfig;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantConfigValidator;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantEmailConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DeliveryOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String TENANT = "tenant-1";

    private static final SmtpConfig SMTP = SmtpConfig.builder()
            .host("smtp.example.com")
            .username("mailer")
            .password("secret")
            .fromEmail("news@example.com")
            .fromName("News")
            .build();

    private static final SendGridConfig SENDGRID = new SendGridConfig("SG.live-key", "news@example.com", "News");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private TestDnsResolver resolver;
    private InMemoryTenantConfigStore configStore;
    private InMemoryEmailRecordStore recordStore;
    private SendGridApiClient apiClient;
    private SmtpTransportPoolManager poolManager;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        resolver = new TestDnsResolver().withHealthyDomain("example.com");
        configStore = new InMemoryTenantConfigStore();
        recordStore = new InMemoryEmailRecordStore();
        apiClient = mock(SendGridApiClient.class);
        poolManager = mock(SmtpTransportPoolManager.class);
        registry = new SimpleMeterRegistry();
    }

    private DeliveryOrchestrator orchestrator() {
        return orchestrator(true);
    }

    private DeliveryOrchestrator orchestrator(boolean presendDomainCheck) {
        DnsRecordGenerator generator = new DnsRecordGenerator();
        DnsRecordValidator validator = new DnsRecordValidator(resolver, generator, Runnable::run, "default", clock);
        BlacklistMonitor blacklistMonitor = new BlacklistMonitor(resolver, List.of("zen.spamhaus.org"), Runnable::run, clock);
        DeliveryMetricsRecorder metrics = new DeliveryMetricsRecorder(registry);
        ProviderRouter router = new ProviderRouter(apiClient, poolManager, null, metrics);
        DeliverabilityScorer scorer = new DeliverabilityScorer(configStore, recordStore, validator, blacklistMonitor,
                new DeliveryProperties.Scoring(), clock);
        return new DeliveryOrchestrator(configStore, new TenantConfigValidator(), recordStore, router, validator, blacklistMonitor,
                scorer, new DkimKeyPairGenerator(generator, clock), poolManager, metrics, presendDomainCheck, clock);
    }

    private static SendRequest request(String to, String correlationId) {
        return new SendRequest(to, "Hello", "<p>Hi</p>", correlationId);
    }

    @Nested
    @DisplayName("configure")
    class Configure {

        @Test
        @DisplayName("Stores the configuration under the given tenant with the update time")
        void stores() {
            // when
            TenantEmailConfig saved = orchestrator().configure(TENANT, TenantEmailConfig.smtp("ignored", SMTP));

            // then
            assertThat(saved.tenantId()).isEqualTo(TENANT);
            assertThat(saved.updatedAt()).isEqualTo(NOW);
            assertThat(configStore.find(TENANT)).contains(saved);
        }

        @Test
        @DisplayName("Rejects an incomplete configuration and keeps the previous one")
        void rejectsIncomplete() {
            // given
            DeliveryOrchestrator orchestrator = orchestrator();
            TenantEmailConfig previous = orchestrator.configure(TENANT, TenantEmailConfig.sendGrid(TENANT, SENDGRID));

            // when / then
            assertThatThrownBy(() -> orchestrator.configure(TENANT, TenantEmailConfig.smtp(TENANT, SMTP.toBuilder().host(null).build())))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("SMTP configuration requires host");
            assertThat(configStore.find(TENANT)).contains(previous);
        }
    }

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        @DisplayName("Marks the record sent with the provider and message id")
        void success() {
            // given
            configStore.save(TenantEmailConfig.smtp(TENANT, SMTP));
            when(poolManager.send(any(), any())).thenReturn(DeliveryResult.success("<1@example.com>", 25, ProviderUsed.SMTP));

            // when
            DeliveryResult result = orchestrator().send(TENANT, request("user@example.org", "campaign-1"));

            // then
            assertThat(result.success()).isTrue();
            assertThat(result.warnings()).isEmpty();
            EmailRecord record = recordStore.findByCorrelationId(TENANT, "campaign-1").orElseThrow();
            assertThat(record.status()).isEqualTo(EmailStatus.SENT);
            assertThat(record.providerUsed()).isEqualTo(ProviderUsed.SMTP);
            assertThat(record.providerMessageId()).isEqualTo("<1@example.com>");
            assertThat(record.sentAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Updates an existing record found by correlation id")
        void existingRecord() {
            // given
            configStore.save(TenantEmailConfig.smtp(TENANT, SMTP));
            recordStore.save(EmailRecord.builder().id("email-7").tenantId(TENANT).correlationId("campaign-7")
                    .status(EmailStatus.SCHEDULED).createdAt(NOW).build());
            when(poolManager.send(any(), any())).thenReturn(DeliveryResult.success("<7@example.com>", 25, ProviderUsed.SMTP));

            // when
            orchestrator().send(TENANT, request("user@example.org", "campaign-7"));

            // then
            assertThat(recordStore.size()).isEqualTo(1);
            assertThat(recordStore.findById("email-7").orElseThrow().status()).isEqualTo(EmailStatus.SENT);
        }

        @Test
        @DisplayName("Fails for a tenant without configuration")
        void unconfiguredTenant() {
            assertThatThrownBy(() -> orchestrator().send("nobody", request("user@example.org", null)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("No email provider configured for tenant nobody");
            assertThat(recordStore.size()).isZero();
        }

        @Test
        @DisplayName("Rejects a malformed recipient before any provider call and marks the record failed")
        void invalidRecipient() {
            // given
            configStore.save(TenantEmailConfig.smtp(TENANT, SMTP));

            // when / then
            assertThatThrownBy(() -> orchestrator().send(TENANT, request("not-an-address", "campaign-2")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Invalid recipient address: not-an-address");
            EmailRecord record = recordStore.findByCorrelationId(TENANT, "campaign-2").orElseThrow();
            assertThat(record.status()).isEqualTo(EmailStatus.FAILED);
            verifyNoInteractions(poolManager, apiClient);
        }

        @Test
        @DisplayName("Returns NONE when no provider can carry the message")
        void noProvider() {
            // given
            configStore.save(TenantEmailConfig.sendGrid(TENANT, SENDGRID));
            when(apiClient.send(any(), any())).thenReturn(DeliveryResult.failure("SendGrid API error 500: oops", 40, ProviderUsed.SENDGRID));

            // when
            DeliveryResult result = orchestrator().send(TENANT, request("user@example.org", "campaign-3"));

            // then
            assertThat(result.success()).isFalse();
            assertThat(result.providerUsed()).isEqualTo(ProviderUsed.NONE);
            assertThat(result.error()).contains("Neither SendGrid nor SMTP is properly configured");
            assertThat(recordStore.findByCorrelationId(TENANT, "campaign-3").orElseThrow().status()).isEqualTo(EmailStatus.FAILED);
            assertThat(registry.get("mailrouter.delivery.unrouted").counter().count()).isEqualTo(1.0);
            assertThat(registry.find("mailrouter.delivery.attempts").tags("provider", "NONE").counter()).isNull();
        }

        @Test
        @DisplayName("Marks the record failed and rethrows when the relay session cannot be built from the settings")
        void unusableDkimKey() {
            // given
            configStore.save(TenantEmailConfig.smtp(TENANT, SMTP));
            when(poolManager.send(any(), any())).thenThrow(
                    new ConfigurationException(TENANT, "DKIM private key for smtp.example.com:587:mailer cannot be loaded"));

            // when / then
            assertThatThrownBy(() -> orchestrator().send(TENANT, request("user@example.org", "campaign-9")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("DKIM private key");
            EmailRecord record = recordStore.findByCorrelationId(TENANT, "campaign-9").orElseThrow();
            assertThat(record.status()).isEqualTo(EmailStatus.FAILED);
            assertThat(record.failureReason()).contains("cannot be loaded");
        }

        @Test
        @DisplayName("Returns a rate-limited result with the wait before the next attempt")
        void rateLimited() {
            // given
            configStore.save(TenantEmailConfig.smtp(TENANT, SMTP));
            when(poolManager.send(any(), any())).thenThrow(new RateLimitException(SmtpConnectionKey.of(SMTP), 42_000));

            // when
            DeliveryResult result = orchestrator().send(TENANT, request("user@example.org", null));

            // then
            assertThat(result.success()).isFalse();
            assertThat(result.isRateLimited()).isTrue();
            assertThat(result.retryAfterMillis()).isEqualTo(42_000L);
            assertThat(result.providerUsed()).isEqualTo(ProviderUsed.SMTP);
            assertThat(result.error()).isEqualTo("Rate limit exceeded. Wait 42 seconds.");
        }

        @Test
        @DisplayName("Attaches SPF and DMARC warnings without blocking the send")
        void presendWarnings() {
            // given
            resolver = new TestDnsResolver();
            configStore.save(TenantEmailConfig.smtp(TENANT, SMTP));
            when(poolManager.send(any(), any())).thenReturn(DeliveryResult.success("<1@example.com>", 25, ProviderUsed.SMTP));

            // when
            DeliveryResult result = orchestrator().send(TENANT, request("user@example.org", null));

            // then
            assertThat(result.success()).isTrue();
            assertThat(result.warnings()).containsExactly(
                    "No SPF record found for domain example.com. This may affect deliverability.",
                    "No DMARC record found for domain example.com. Consider adding one for better reputation.");
        }

        @Test
        @DisplayName("Skips the pre-send check when it is disabled")
        void presendCheckDisabled() {
            // given
            resolver = new TestDnsResolver();
            TenantEmailConfig config = configStore.save(TenantEmailConfig.smtp(TENANT, SMTP));

            // then
            assertThat(orchestrator(false).presendWarnings(config)).isEmpty();
        }
    }

    @Nested
    @DisplayName("DKIM")
    class Dkim {

        @Test
        @DisplayName("Generating a key for an SMTP tenant enables signing with it")
        void enablesSigning() {
            // given
            configStore.save(TenantEmailConfig.smtp(TENANT, SMTP));

            // when
            DkimKeyPair keyPair = orchestrator().generateDkimKeyPair(TENANT);

            // then
            SmtpConfig stored = (SmtpConfig) configStore.find(TENANT).orElseThrow().providerConfig();
            assertThat(stored.isDkimEnabled()).isTrue();
            assertThat(stored.dkim().privateKey()).isEqualTo(keyPair.privateKey());
            assertThat(stored.dkim().selector()).isEqualTo(keyPair.selector());
            assertThat(stored.dkim().domain()).isEqualTo("example.com");
            assertThat(keyPair.dnsRecord().name()).isEqualTo(keyPair.selector() + "._domainkey.example.com");
        }

        @Test
        @DisplayName("Refuses tenants that do not send through SMTP")
        void requiresSmtp() {
            // given
            configStore.save(TenantEmailConfig.sendGrid(TENANT, SENDGRID));

            // when / then
            assertThatThrownBy(() -> orchestrator().generateDkimKeyPair(TENANT))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("DKIM key generation requires an SMTP configuration");
        }
    }

    @Nested
    @DisplayName("validateEmailSetup")
    class ValidateEmailSetup {

        @Test
        @DisplayName("Reports a tenant without configuration")
        void unconfigured() {
            // when
            EmailSetupReport report = orchestrator().validateEmailSetup(TENANT);

            // then
            assertThat(report.valid()).isFalse();
            assertThat(report.provider()).isNull();
            assertThat(report.issues()).containsExactly("No email provider configured");
            assertThat(report.recommendations()).containsExactly("Configure an email provider (SendGrid or SMTP)");
        }

        @Test
        @DisplayName("A healthy SendGrid setup is valid")
        void healthy() {
            // given
            configStore.save(TenantEmailConfig.sendGrid(TENANT, SENDGRID));

            // when
            EmailSetupReport report = orchestrator().validateEmailSetup(TENANT);

            // then
            assertThat(report.valid()).isTrue();
            assertThat(report.provider()).isEqualTo(ProviderKind.SENDGRID);
            assertThat(report.domainGuide().overallScore()).isEqualTo(100);
            assertThat(report.checkedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Flags a placeholder key and a weak domain")
        void placeholderAndWeakDomain() {
            // given
            resolver = new TestDnsResolver();
            configStore.save(TenantEmailConfig.sendGrid(TENANT,
                    new SendGridConfig(SendGridConfig.PLACEHOLDER_API_KEY, "news@example.com", null)));

            // when
            EmailSetupReport report = orchestrator().validateEmailSetup(TENANT);

            // then
            DomainSetupGuide guide = report.domainGuide();
            assertThat(report.valid()).isFalse();
            assertThat(report.issues().get(0)).isEqualTo("SendGrid API key is missing or using placeholder value");
            assertThat(report.issues()).containsAll(guide.issues()).hasSize(1 + guide.issues().size());
            assertThat(report.recommendations()).containsExactly(
                    "Add a valid SendGrid API key",
                    "Improve DNS configuration (score: 0/100)");
        }

        @Test
        @DisplayName("Flags SMTP without credentials")
        void smtpWithoutCredentials() {
            // given
            configStore.save(TenantEmailConfig.smtp(TENANT, SMTP.toBuilder().username(null).build()));

            // when
            EmailSetupReport report = orchestrator().validateEmailSetup(TENANT);

            // then
            assertThat(report.valid()).isFalse();
            assertThat(report.provider()).isEqualTo(ProviderKind.SMTP);
            assertThat(report.issues()).containsExactly("SMTP configuration is incomplete");
        }
    }

    @Test
    @DisplayName("The test email goes through normal routing with a test correlation id")
    void sendTestEmail() {
        // given
        configStore.save(TenantEmailConfig.smtp(TENANT, SMTP));
        when(poolManager.send(any(), any())).thenReturn(DeliveryResult.success("<9@example.com>", 25, ProviderUsed.SMTP));

        // when
        DeliveryResult result = orchestrator().sendTestEmail(TENANT, "admin@example.org");

        // then
        assertThat(result.success()).isTrue();
        ArgumentCaptor<OutboundMessage> captor = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(poolManager).send(any(), captor.capture());
        OutboundMessage message = captor.getValue();
        assertThat(message.subject()).isEqualTo(DeliveryOrchestrator.TEST_EMAIL_SUBJECT);
        assertThat(message.correlationId()).startsWith("test-");
        assertThat(message.htmlContent()).contains("<strong>Provider:</strong> SMTP");
        assertThat(recordStore.findByCorrelationId(TENANT, message.correlationId())).get()
                .extracting(EmailRecord::status).isEqualTo(EmailStatus.SENT);
    }
}
