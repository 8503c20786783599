package io.github.hotbrkm.mailrouter.engine.email.config;

import io.github.hotbrkm.mailrouter.engine.email.send.entry.DeliveryOrchestrator;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.SmtpTransportPoolManager;
import io.github.hotbrkm.mailrouter.engine.email.tenant.InMemoryTenantConfigStore;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantConfigStore;
import io.github.hotbrkm.mailrouter.engine.email.tracking.DeliveryEventRecorder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryEngineConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(DeliveryEngineConfig.class);

    @Test
    @DisplayName("Wires the engine with in-memory stores by default")
    void defaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(DeliveryOrchestrator.class);
            assertThat(context).hasSingleBean(DeliveryEventRecorder.class);
            assertThat(context).hasSingleBean(SmtpTransportPoolManager.class);
            assertThat(context.getBean(TenantConfigStore.class)).isInstanceOf(InMemoryTenantConfigStore.class);

            DeliveryProperties properties = context.getBean(DeliveryProperties.class);
            assertThat(properties.getSmtp().getRateLimitPerMinute()).isEqualTo(10);
            assertThat(properties.getBlacklist().getZones()).hasSize(5);
            assertThat(properties.getFallbackSmtp().toSmtpConfig()).isEmpty();
        });
    }

    @Test
    @DisplayName("Binds delivery properties")
    void bindsProperties() {
        contextRunner
                .withPropertyValues(
                        "delivery.smtp.rate-limit-per-minute=20",
                        "delivery.dns.default-dkim-selector=mail",
                        "delivery.fallback-smtp.host=relay.example.com",
                        "delivery.fallback-smtp.from-email=noreply@example.com")
                .run(context -> {
                    DeliveryProperties properties = context.getBean(DeliveryProperties.class);
                    assertThat(properties.getSmtp().resolveRateLimitPerMinute(0)).isEqualTo(20);
                    assertThat(properties.getDns().resolveDkimSelector(null)).isEqualTo("mail");
                    assertThat(properties.getFallbackSmtp().toSmtpConfig()).hasValueSatisfying(smtp -> {
                        assertThat(smtp.host()).isEqualTo("relay.example.com");
                        assertThat(smtp.port()).isEqualTo(587);
                    });
                });
    }

    @Test
    @DisplayName("Uses a host application's tenant store when one is registered")
    void customTenantStore() {
        TenantConfigStore custom = new InMemoryTenantConfigStore();

        contextRunner
                .withBean("customTenantConfigStore", TenantConfigStore.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(TenantConfigStore.class);
                    assertThat(context.getBean(TenantConfigStore.class)).isSameAs(custom);
                });
    }
}
