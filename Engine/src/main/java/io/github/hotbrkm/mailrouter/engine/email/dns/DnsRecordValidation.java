package io.github.hotbrkm.mailrouter.engine.email.dns;

import java.time.Instant;
import java.util.List;

/**
 * Result of checking one record type of a domain.
 *
 * @param currentValue     the published record, {@code null} when none was found
 * @param recommendedValue the record to publish, {@code null} when the current one is valid
 * @param issues           problems and advisories; a valid record may still carry advisories
 */
public record DnsRecordValidation(String domain,
                                  DnsRecordType recordType,
                                  boolean valid,
                                  String currentValue,
                                  String recommendedValue,
                                  List<String> issues,
                                  Instant lastChecked) {

    public DnsRecordValidation {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean isPresent() {
        return currentValue != null;
    }

    /**
     * Points this record contributes to the overall score.
     */
    public double scoreContribution() {
        if (valid) {
            return recordType.weight();
        }
        return isPresent() ? recordType.weight() * 0.3 : 0;
    }
}
