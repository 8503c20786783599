package io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp;

import io.github.hotbrkm.mailrouter.engine.email.config.DeliveryProperties;
import io.github.hotbrkm.mailrouter.engine.email.send.OutboundMessage;
import io.github.hotbrkm.mailrouter.engine.email.send.result.DeliveryResult;
import io.github.hotbrkm.mailrouter.engine.email.send.result.ProviderUsed;
import io.github.hotbrkm.mailrouter.engine.email.tenant.ConfigurationException;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SmtpConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the keyed SMTP sessions and their send statistics.
 * <p>
 * Per key {@code (host, port, username)}:
 * 1) admission against a sliding 60 second window, before any network activity
 * 2) at most one verified session, created on first use and shared afterwards
 * 3) statistics updated after every admitted attempt
 */
@Slf4j
public class SmtpTransportPoolManager {

    private final SmtpTransportSessionFactory sessionFactory;
    private final DeliveryProperties.Smtp smtpDefaults;
    private final DeliveryProperties.Scoring scoring;
    private final Clock clock;

    private final Map<SmtpConnectionKey, SmtpTransportSession> sessions = new ConcurrentHashMap<>();
    private final Map<SmtpConnectionKey, Object> creationLocks = new ConcurrentHashMap<>();
    private final Map<SmtpConnectionKey, ConnectionStats> stats = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(true);

    public SmtpTransportPoolManager(SmtpTransportSessionFactory sessionFactory, DeliveryProperties.Smtp smtpDefaults,
                                    DeliveryProperties.Scoring scoring, Clock clock) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory must not be null");
        this.smtpDefaults = Objects.requireNonNull(smtpDefaults, "smtpDefaults must not be null");
        this.scoring = Objects.requireNonNull(scoring, "scoring must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void start() {
        running.set(true);
        log.info("SMTP transport pool started");
    }

    /**
     * Returns the pooled session for the configuration's key, creating and verifying it on first use.
     *
     * @throws TransportException when a new session cannot reach or log in to the relay
     */
    public SmtpTransportSession acquire(SmtpConfig config) {
        ensureRunning();
        SmtpConnectionKey key = SmtpConnectionKey.of(config);
        SmtpTransportSession existing = sessions.get(key);
        if (existing != null) {
            return existing;
        }

        Object lock = creationLocks.computeIfAbsent(key, k -> new Object());
        synchronized (lock) {
            existing = sessions.get(key);
            if (existing != null) {
                return existing;
            }
            ensureRunning();
            SmtpTransportSession created = sessionFactory.create(config);
            sessions.put(key, created);
            return created;
        }
    }

    /**
     * Sends through the pooled session of the configuration.
     * Acquisition and per-message failures are returned as a failed result and counted against the key.
     *
     * @throws RateLimitException     when the key's window is full; the attempt is not counted
     * @throws ConfigurationException when the session cannot be built from the configuration; counted as a failure
     */
    public DeliveryResult send(SmtpConfig config, OutboundMessage message) {
        ensureRunning();
        SmtpConnectionKey key = SmtpConnectionKey.of(config);
        int limit = smtpDefaults.resolveRateLimitPerMinute(config.rateLimitPerMinute());
        ConnectionStats connectionStats = stats.computeIfAbsent(key, k -> new ConnectionStats(limit));

        long waitMillis = connectionStats.tryAdmit(clock.millis(), limit);
        if (waitMillis > 0) {
            log.warn("SMTP rate limit reached. key={}, limit={}/min, waitMillis={}", key, limit, waitMillis);
            throw new RateLimitException(key, waitMillis);
        }

        long startMillis = clock.millis();
        try {
            SmtpTransportSession session = acquire(config);
            String messageId = session.send(message);
            long deliveryTime = clock.millis() - startMillis;
            connectionStats.recordSuccess(deliveryTime);
            log.info("Email sent via SMTP. key={}, to={}, messageId={}, deliveryTime={}ms", key, message.to(), messageId, deliveryTime);
            return DeliveryResult.success(messageId, deliveryTime, ProviderUsed.SMTP)
                    .withReputationScore(reputationScore(connectionStats));
        } catch (TransportException | SendException e) {
            long deliveryTime = clock.millis() - startMillis;
            connectionStats.recordFailure(scoring.getFailurePenalty());
            log.warn("SMTP send failed. key={}, to={}, correlationId={}, message={}", key, message.to(), message.correlationId(),
                    e.getMessage());
            return DeliveryResult.failure(e.getMessage(), deliveryTime, ProviderUsed.SMTP)
                    .withReputationScore(reputationScore(connectionStats));
        } catch (ConfigurationException e) {
            connectionStats.recordFailure(scoring.getFailurePenalty());
            log.warn("SMTP session rejected by configuration. key={}, correlationId={}, message={}", key, message.correlationId(),
                    e.getMessage());
            throw e;
        }
    }

    /**
     * True when a verified session exists or can be created for the configuration.
     */
    public boolean isAvailable(SmtpConfig config) {
        if (config == null || !running.get()) {
            return false;
        }
        try {
            acquire(config);
            return true;
        } catch (TransportException | ConfigurationException e) {
            log.warn("SMTP relay unavailable. key={}, message={}", SmtpConnectionKey.of(config), e.getMessage());
            return false;
        }
    }

    public int reputationScore(SmtpConnectionKey key) {
        ConnectionStats connectionStats = stats.get(key);
        return connectionStats == null ? 50 : reputationScore(connectionStats);
    }

    public Optional<ConnectionStatsSnapshot> getConnectionStats(SmtpConnectionKey key) {
        return Optional.ofNullable(stats.get(key)).map(s -> snapshot(key, s));
    }

    public Map<SmtpConnectionKey, ConnectionStatsSnapshot> getConnectionStats() {
        Map<SmtpConnectionKey, ConnectionStatsSnapshot> snapshots = new LinkedHashMap<>();
        stats.forEach((key, s) -> snapshots.put(key, snapshot(key, s)));
        return snapshots;
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Closes every pooled session and clears all statistics. Safe to call repeatedly.
     */
    public void shutdown() {
        boolean wasRunning = running.getAndSet(false);
        for (Map.Entry<SmtpConnectionKey, SmtpTransportSession> entry : sessions.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.error("Failed to close SMTP session. key={}", entry.getKey(), e);
            }
        }
        sessions.clear();
        creationLocks.clear();
        stats.clear();
        if (wasRunning) {
            log.info("SMTP transport pool shut down");
        }
    }

    private int reputationScore(ConnectionStats connectionStats) {
        return connectionStats.reputationScore(scoring.getSuccessRateWeight(), scoring.getDeliveryTimeWeight());
    }

    private ConnectionStatsSnapshot snapshot(SmtpConnectionKey key, ConnectionStats connectionStats) {
        return connectionStats.snapshot(key, scoring.getSuccessRateWeight(), scoring.getDeliveryTimeWeight());
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new IllegalStateException("SMTP transport pool is shut down");
        }
    }
}
