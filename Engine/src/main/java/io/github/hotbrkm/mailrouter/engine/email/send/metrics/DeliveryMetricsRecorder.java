package io.github.hotbrkm.mailrouter.engine.email.send.metrics;

import io.github.hotbrkm.mailrouter.engine.email.send.result.DeliveryResult;
import io.github.hotbrkm.mailrouter.engine.email.send.result.ProviderUsed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class DeliveryMetricsRecorder {

    private final MeterRegistry registry;

    public DeliveryMetricsRecorder(MeterRegistry registry) {
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    public void recordAttempt(DeliveryResult result) {
        if (result == null) {
            return;
        }

        registry.counter("mailrouter.delivery.attempts",
                "provider", result.providerUsed().name(),
                "outcome", result.success() ? "success" : "failure")
                .increment();

        if (result.deliveryTimeMs() > 0) {
            registry.summary("mailrouter.delivery.time",
                    "provider", result.providerUsed().name())
                    .record(result.deliveryTimeMs());
        }
    }

    /**
     * Counts a send that no provider could carry. Attempts already made are counted by {@link #recordAttempt}.
     */
    public void recordUnrouted() {
        registry.counter("mailrouter.delivery.unrouted").increment();
    }

    public void recordFallback(ProviderUsed from, ProviderUsed to) {
        registry.counter("mailrouter.delivery.fallbacks",
                "from", safe(from),
                "to", safe(to))
                .increment();
    }

    public void recordRateLimited(ProviderUsed provider) {
        registry.counter("mailrouter.delivery.rate_limited",
                "provider", safe(provider))
                .increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private String safe(ProviderUsed value) {
        return value == null ? "none" : value.name();
    }
}
