package io.github.hotbrkm.mailrouter.engine.email.config;

import io.github.hotbrkm.mailrouter.engine.email.dns.DkimKeyPairGenerator;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordGenerator;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordValidator;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsResolver;
import io.github.hotbrkm.mailrouter.engine.email.reputation.BlacklistMonitor;
import io.github.hotbrkm.mailrouter.engine.email.reputation.DeliverabilityScorer;
import io.github.hotbrkm.mailrouter.engine.email.send.entry.DeliveryOrchestrator;
import io.github.hotbrkm.mailrouter.engine.email.send.metrics.DeliveryMetricsRecorder;
import io.github.hotbrkm.mailrouter.engine.email.send.routing.ProviderRouter;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.api.SendGridApiClient;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.SmtpTransportPoolManager;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.SmtpTransportSessionFactory;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailRecordStore;
import io.github.hotbrkm.mailrouter.engine.email.store.InMemoryEmailRecordStore;
import io.github.hotbrkm.mailrouter.engine.email.tenant.InMemoryTenantConfigStore;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantConfigStore;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantConfigValidator;
import io.github.hotbrkm.mailrouter.engine.email.tracking.DeliveryEventRecorder;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(DeliveryProperties.class)
public class DeliveryEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock deliveryClock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool shared by DNS record and block list lookups.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService dnsLookupExecutor(DeliveryProperties properties) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "dns-lookup-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getDns().getLookupThreads()), threadFactory);
    }

    @Bean
    public DnsResolver dnsResolver(DeliveryProperties properties) {
        DeliveryProperties.Dns dns = properties.getDns();
        return new DnsResolver(dns.getServers(), Duration.ofMillis(dns.getTimeoutMs()), dns.getRetryCount());
    }

    @Bean
    public DnsRecordGenerator dnsRecordGenerator() {
        return new DnsRecordGenerator();
    }

    @Bean
    public DnsRecordValidator dnsRecordValidator(DnsResolver dnsResolver, DnsRecordGenerator dnsRecordGenerator,
                                                 ExecutorService dnsLookupExecutor, DeliveryProperties properties, Clock clock) {
        return new DnsRecordValidator(dnsResolver, dnsRecordGenerator, dnsLookupExecutor,
                properties.getDns().resolveDkimSelector(null), clock);
    }

    @Bean
    public DkimKeyPairGenerator dkimKeyPairGenerator(DnsRecordGenerator dnsRecordGenerator, Clock clock) {
        return new DkimKeyPairGenerator(dnsRecordGenerator, clock);
    }

    @Bean
    public BlacklistMonitor blacklistMonitor(DnsResolver dnsResolver, ExecutorService dnsLookupExecutor, DeliveryProperties properties,
                                             Clock clock) {
        return new BlacklistMonitor(dnsResolver, properties.getBlacklist().getZones(), dnsLookupExecutor, clock);
    }

    @Bean
    public SmtpTransportSessionFactory smtpTransportSessionFactory(DeliveryProperties properties) {
        return new SmtpTransportSessionFactory(properties.getSmtp(), properties.getMailer());
    }

    /**
     * Calls start() on application startup and shutdown() on termination.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public SmtpTransportPoolManager smtpTransportPoolManager(SmtpTransportSessionFactory sessionFactory, DeliveryProperties properties,
                                                             Clock clock) {
        return new SmtpTransportPoolManager(sessionFactory, properties.getSmtp(), properties.getScoring(), clock);
    }

    @Bean
    public SendGridApiClient sendGridApiClient(Clock clock) {
        return new SendGridApiClient(clock);
    }

    @Bean
    public DeliveryMetricsRecorder deliveryMetricsRecorder(ObjectProvider<MeterRegistry> meterRegistry) {
        return new DeliveryMetricsRecorder(meterRegistry.getIfAvailable());
    }

    @Bean
    public ProviderRouter providerRouter(SendGridApiClient sendGridApiClient, SmtpTransportPoolManager poolManager,
                                         DeliveryMetricsRecorder metrics, DeliveryProperties properties) {
        return new ProviderRouter(sendGridApiClient, poolManager, properties.getFallbackSmtp().toSmtpConfig().orElse(null), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantConfigStore tenantConfigStore() {
        return new InMemoryTenantConfigStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailRecordStore emailRecordStore() {
        return new InMemoryEmailRecordStore();
    }

    @Bean
    public TenantConfigValidator tenantConfigValidator() {
        return new TenantConfigValidator();
    }

    @Bean
    public DeliverabilityScorer deliverabilityScorer(TenantConfigStore tenantConfigStore, EmailRecordStore emailRecordStore,
                                                     DnsRecordValidator dnsRecordValidator, BlacklistMonitor blacklistMonitor,
                                                     DeliveryProperties properties, Clock clock) {
        return new DeliverabilityScorer(tenantConfigStore, emailRecordStore, dnsRecordValidator, blacklistMonitor,
                properties.getScoring(), clock);
    }

    @Bean
    public DeliveryEventRecorder deliveryEventRecorder(EmailRecordStore emailRecordStore, Clock clock) {
        return new DeliveryEventRecorder(emailRecordStore, clock);
    }

    @Bean
    public DeliveryOrchestrator deliveryOrchestrator(TenantConfigStore tenantConfigStore,
                                                     TenantConfigValidator tenantConfigValidator,
                                                     EmailRecordStore emailRecordStore,
                                                     ProviderRouter providerRouter,
                                                     DnsRecordValidator dnsRecordValidator,
                                                     BlacklistMonitor blacklistMonitor,
                                                     DeliverabilityScorer deliverabilityScorer,
                                                     DkimKeyPairGenerator dkimKeyPairGenerator,
                                                     SmtpTransportPoolManager smtpTransportPoolManager,
                                                     DeliveryMetricsRecorder deliveryMetricsRecorder,
                                                     DeliveryProperties properties,
                                                     Clock clock) {
        return new DeliveryOrchestrator(tenantConfigStore, tenantConfigValidator, emailRecordStore, providerRouter, dnsRecordValidator,
                blacklistMonitor, deliverabilityScorer, dkimKeyPairGenerator, smtpTransportPoolManager, deliveryMetricsRecorder,
                properties.isPresendDomainCheck(), clock);
    }
}
