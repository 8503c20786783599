package io.github.hotbrkm.mailrouter.engine.email.reputation;

import java.util.List;

/**
 * @param warmupPlan empty when the reputation needs no warmup
 */
public record DeliveryOptimization(int recommendedVolume,
                                   List<String> optimalSendingTimes,
                                   List<WarmupStep> warmupPlan,
                                   List<String> contentOptimizations) {

    public DeliveryOptimization {
        optimalSendingTimes = List.copyOf(optimalSendingTimes);
        warmupPlan = List.copyOf(warmupPlan);
        contentOptimizations = List.copyOf(contentOptimizations);
    }
}
