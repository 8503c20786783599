package io.github.hotbrkm.mailrouter.engine.email.send.routing;

import io.github.hotbrkm.mailrouter.engine.email.send.OutboundMessage;
import io.github.hotbrkm.mailrouter.engine.email.send.SendRequest;
import io.github.hotbrkm.mailrouter.engine.email.send.metrics.DeliveryMetricsRecorder;
import io.github.hotbrkm.mailrouter.engine.email.send.result.DeliveryResult;
import io.github.hotbrkm.mailrouter.engine.email.send.result.ProviderUsed;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.api.SendGridApiClient;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.RateLimitException;
import io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp.SmtpTransportPoolManager;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SendGridConfig;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SmtpConfig;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantEmailConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Chooses the provider for one send. This is a fallback chain, not a retry loop: each provider is tried at most once.
 * Policy priority:
 * 1) SMTP tenants send through their own relay only
 * 2) SendGrid tenants with a usable API key try the HTTP API first
 * 3) A failed or skipped API attempt falls back to the tenant's relay, else the platform relay, when it is reachable
 * 4) Otherwise {@link NoProviderAvailableException}
 */
@Slf4j
public class ProviderRouter {

    private final SendGridApiClient apiClient;
    private final SmtpTransportPoolManager poolManager;
    private final SmtpConfig platformFallback;
    private final DeliveryMetricsRecorder metrics;

    /**
     * @param platformFallback relay for SendGrid tenants without one of their own, may be {@code null}
     */
    public ProviderRouter(SendGridApiClient apiClient, SmtpTransportPoolManager poolManager, SmtpConfig platformFallback,
                          DeliveryMetricsRecorder metrics) {
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient must not be null");
        this.poolManager = Objects.requireNonNull(poolManager, "poolManager must not be null");
        this.platformFallback = platformFallback;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * @throws RateLimitException           when the SMTP relay's window is full
     * @throws NoProviderAvailableException when the API failed or was skipped and no reachable relay exists
     */
    public DeliveryResult route(TenantEmailConfig tenant, SendRequest request) {
        if (tenant.providerConfig() instanceof SmtpConfig smtp) {
            return sendSmtp(tenant, smtp, request);
        }

        SendGridConfig sendGrid = (SendGridConfig) tenant.providerConfig();
        DeliveryResult primary = null;
        if (sendGrid.hasUsableApiKey()) {
            primary = sendApi(tenant, sendGrid, request);
            if (primary.success()) {
                return primary;
            }
            log.warn("SendGrid attempt failed, trying SMTP fallback. tenantId={}, correlationId={}, error={}",
                    tenant.tenantId(), request.correlationId(), primary.error());
        } else {
            log.warn("SendGrid API key missing or placeholder, skipping API. tenantId={}", tenant.tenantId());
        }

        String primaryError = primary == null ? "API key is missing or a placeholder" : primary.error();
        Optional<SmtpConfig> relay = tenant.smtpConfig().or(() -> Optional.ofNullable(platformFallback));
        if (relay.isEmpty() || !poolManager.isAvailable(relay.get())) {
            throw new NoProviderAvailableException(tenant.tenantId(), primaryError);
        }

        metrics.recordFallback(ProviderUsed.SENDGRID, ProviderUsed.SMTP);
        log.info("Routing to SMTP fallback. tenantId={}, correlationId={}", tenant.tenantId(), request.correlationId());
        DeliveryResult fallback = sendSmtp(tenant, relay.get(), request);
        return fallback.withWarning("SendGrid API not used (" + primaryError + "); SMTP fallback attempted");
    }

    private DeliveryResult sendApi(TenantEmailConfig tenant, SendGridConfig sendGrid, SendRequest request) {
        DeliveryResult result = apiClient.send(sendGrid, OutboundMessage.of(tenant.tenantId(), sendGrid, request));
        metrics.recordAttempt(result);
        return result;
    }

    private DeliveryResult sendSmtp(TenantEmailConfig tenant, SmtpConfig smtp, SendRequest request) {
        try {
            DeliveryResult result = poolManager.send(smtp, OutboundMessage.of(tenant.tenantId(), smtp, request));
            metrics.recordAttempt(result);
            return result;
        } catch (RateLimitException e) {
            metrics.recordRateLimited(ProviderUsed.SMTP);
            throw e;
        }
    }
}
