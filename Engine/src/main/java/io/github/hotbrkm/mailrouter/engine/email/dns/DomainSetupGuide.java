package io.github.hotbrkm.mailrouter.engine.email.dns;

import java.util.ArrayList;
import java.util.List;

public record DomainSetupGuide(String domain,
                               DnsRecordValidation spf,
                               DnsRecordValidation dkim,
                               DnsRecordValidation dmarc,
                               DnsRecordValidation mx,
                               int overallScore,
                               List<String> setupInstructions) {

    public DomainSetupGuide {
        setupInstructions = setupInstructions == null ? List.of() : List.copyOf(setupInstructions);
    }

    public List<DnsRecordValidation> records() {
        return List.of(spf, dkim, dmarc, mx);
    }

    public List<String> issues() {
        List<String> issues = new ArrayList<>();
        for (DnsRecordValidation record : records()) {
            issues.addAll(record.issues());
        }
        return issues;
    }

    public List<DnsRecordValidation> recommendedRecords() {
        return records().stream()
                .filter(record -> record.recommendedValue() != null)
                .toList();
    }
}
