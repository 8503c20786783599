package io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-key send bookkeeping and sliding-window admission. All methods are atomic per instance.
 */
public class ConnectionStats {

    static final long WINDOW_MILLIS = 60_000L;
    static final int INITIAL_REPUTATION = 100;

    private final Deque<Long> recentSends = new ArrayDeque<>();
    private int rateLimitPerMinute;
    private long totalSent;
    private long totalFailed;
    private double averageDeliveryTimeMs;
    private int reputation = INITIAL_REPUTATION;

    public ConnectionStats(int rateLimitPerMinute) {
        this.rateLimitPerMinute = rateLimitPerMinute;
    }

    /**
     * Prunes the window to the trailing 60 seconds and admits the send when the window has room,
     * recording its timestamp.
     *
     * @return {@code 0} when admitted, otherwise the milliseconds until the oldest send leaves the window
     */
    public synchronized long tryAdmit(long nowMillis, int limit) {
        this.rateLimitPerMinute = limit;
        while (!recentSends.isEmpty() && nowMillis - recentSends.peekFirst() >= WINDOW_MILLIS) {
            recentSends.pollFirst();
        }
        if (recentSends.size() >= limit) {
            return Math.max(1L, recentSends.peekFirst() + WINDOW_MILLIS - nowMillis);
        }
        recentSends.addLast(nowMillis);
        return 0L;
    }

    public synchronized void recordSuccess(long deliveryTimeMs) {
        totalSent++;
        averageDeliveryTimeMs = (averageDeliveryTimeMs * (totalSent - 1) + deliveryTimeMs) / totalSent;
    }

    public synchronized void recordFailure(int penalty) {
        totalFailed++;
        reputation = Math.max(0, reputation - Math.max(0, penalty));
    }

    /**
     * Blends reliability and speed: {@code successRate * successWeight + (deliveryTimeScore / 100) * timeWeight}
     * where {@code deliveryTimeScore = min(100, 100000 / avgDeliveryTimeMs)}. With the default 70/30 weights the
     * result stays within 0..100.
     */
    public synchronized int reputationScore(double successWeight, double timeWeight) {
        long attempts = totalSent + totalFailed;
        if (attempts == 0) {
            return 50;
        }
        double successRate = (double) totalSent / attempts;
        double average = averageDeliveryTimeMs > 0 ? averageDeliveryTimeMs : 1000d;
        double deliveryTimeScore = Math.min(100d, 100_000d / average);
        long score = Math.round(successRate * successWeight + deliveryTimeScore / 100d * timeWeight);
        return (int) Math.max(0, Math.min(100, score));
    }

    public synchronized ConnectionStatsSnapshot snapshot(SmtpConnectionKey key, double successWeight, double timeWeight) {
        return new ConnectionStatsSnapshot(key, totalSent, totalFailed, averageDeliveryTimeMs, recentSends.size(),
                rateLimitPerMinute, reputation, reputationScore(successWeight, timeWeight));
    }
}
