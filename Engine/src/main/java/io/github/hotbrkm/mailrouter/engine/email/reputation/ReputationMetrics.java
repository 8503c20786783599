package io.github.hotbrkm.mailrouter.engine.email.reputation;

import java.util.List;

/**
 * Sender reputation of a tenant over the trailing history window. Rates are percentages.
 */
public record ReputationMetrics(double deliveryRate,
                                double bounceRate,
                                double complaintRate,
                                double unsubscribeRate,
                                double spamRate,
                                int reputationScore,
                                DomainReputation domainReputation,
                                List<String> recommendations,
                                List<String> warnings) {

    public ReputationMetrics {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
