package io.github.hotbrkm.mailrouter.engine.email.reputation;

import java.util.List;

/**
 * @param targetDomains recipient domains to send to on this day, {@code "*"} for all
 */
public record WarmupStep(int day, int maxEmails, List<String> targetDomains, String description) {

    public WarmupStep {
        targetDomains = List.copyOf(targetDomains);
    }
}
