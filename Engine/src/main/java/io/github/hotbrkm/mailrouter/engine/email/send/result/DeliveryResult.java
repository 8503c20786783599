package io.github.hotbrkm.mailrouter.engine.email.send.result;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one send attempt.
 *
 * @param retryAfterMillis earliest useful retry for rate-limited attempts, otherwise {@code null}
 * @param reputationScore  SMTP connection reputation after the attempt, {@code null} for API sends
 */
public record DeliveryResult(boolean success,
                             String messageId,
                             String error,
                             long deliveryTimeMs,
                             ProviderUsed providerUsed,
                             List<String> warnings,
                             Long retryAfterMillis,
                             Integer reputationScore) {

    public DeliveryResult {
        Objects.requireNonNull(providerUsed, "providerUsed must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static DeliveryResult success(String messageId, long deliveryTimeMs, ProviderUsed providerUsed) {
        return new DeliveryResult(true, messageId, null, deliveryTimeMs, providerUsed, List.of(), null, null);
    }

    public static DeliveryResult failure(String error, long deliveryTimeMs, ProviderUsed providerUsed) {
        return new DeliveryResult(false, null, error, deliveryTimeMs, providerUsed, List.of(), null, null);
    }

    public static DeliveryResult rateLimited(String error, long retryAfterMillis, ProviderUsed providerUsed) {
        return new DeliveryResult(false, null, error, 0L, providerUsed, List.of(), retryAfterMillis, null);
    }

    public DeliveryResult withReputationScore(int score) {
        return new DeliveryResult(success, messageId, error, deliveryTimeMs, providerUsed, warnings, retryAfterMillis, score);
    }

    public DeliveryResult withWarnings(List<String> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(additional);
        return new DeliveryResult(success, messageId, error, deliveryTimeMs, providerUsed, merged, retryAfterMillis, reputationScore);
    }

    public DeliveryResult withWarning(String warning) {
        return withWarnings(List.of(warning));
    }

    public boolean isRateLimited() {
        return retryAfterMillis != null;
    }
}
