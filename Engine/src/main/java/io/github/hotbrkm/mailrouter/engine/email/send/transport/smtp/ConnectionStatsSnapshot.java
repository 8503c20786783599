package io.github.hotbrkm.mailrouter.engine.email.send.transport.smtp;

/**
 * Point-in-time copy of {@link ConnectionStats}.
 *
 * @param recentSends     sends admitted in the current window, as of the last admission check
 * @param reputation      local counter, lowered on every failure
 * @param reputationScore blended reliability and speed score
 */
public record ConnectionStatsSnapshot(SmtpConnectionKey key,
                                      long totalSent,
                                      long totalFailed,
                                      double averageDeliveryTimeMs,
                                      int recentSends,
                                      int rateLimitPerMinute,
                                      int reputation,
                                      int reputationScore) {
}
