package io.github.hotbrkm.mailrouter.engine.email.send.entry;

import io.github.hotbrkm.mailrouter.engine.email.dns.DomainSetupGuide;
import io.github.hotbrkm.mailrouter.engine.email.tenant.ProviderKind;

import java.time.Instant;
import java.util.List;

/**
 * @param provider    configured provider, {@code null} when the tenant has none
 * @param domainGuide DNS check of the sending domain, {@code null} when it could not be run
 */
public record EmailSetupReport(boolean valid,
                               ProviderKind provider,
                               List<String> issues,
                               List<String> recommendations,
                               DomainSetupGuide domainGuide,
                               Instant checkedAt) {

    public EmailSetupReport {
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }
}
