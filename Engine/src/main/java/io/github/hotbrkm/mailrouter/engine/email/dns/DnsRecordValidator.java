package io.github.hotbrkm.mailrouter.engine.email.dns;

import io.github.hotbrkm.mailrouter.engine.email.dns.DnsResolver.MxHost;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Resolves and scores the SPF, DKIM, DMARC and MX records of a sending domain.
 * <p>
 * The four lookups of one domain run concurrently on the supplied executor and are joined before scoring.
 * Lookup failures never escape: they become an issue on the affected record, which then scores 0.
 */
@Slf4j
public class DnsRecordValidator {

    private static final String SPF_HOST_ISSUE = "SPF record exists but may not include your SMTP server";

    private final DnsResolver resolver;
    private final DnsRecordGenerator generator;
    private final Executor executor;
    private final String defaultDkimSelector;
    private final Clock clock;

    public DnsRecordValidator(DnsResolver resolver, DnsRecordGenerator generator, Executor executor, String defaultDkimSelector,
                              Clock clock) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.defaultDkimSelector = defaultDkimSelector == null || defaultDkimSelector.isBlank() ? "default" : defaultDkimSelector;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public DomainSetupGuide validateDomain(String domain, String smtpHost) {
        return validateDomain(domain, smtpHost, defaultDkimSelector);
    }

    public DomainSetupGuide validateDomain(String domain, String smtpHost, String dkimSelector) {
        String target = normalizeDomain(domain);
        String selector = dkimSelector == null || dkimSelector.isBlank() ? defaultDkimSelector : dkimSelector.trim();
        log.info("Validating DNS setup. domain={}, smtpHost={}, selector={}", target, smtpHost, selector);

        CompletableFuture<DnsRecordValidation> spf = validateAsync(DnsRecordType.SPF, target, smtpHost, selector);
        CompletableFuture<DnsRecordValidation> dkim = validateAsync(DnsRecordType.DKIM, target, smtpHost, selector);
        CompletableFuture<DnsRecordValidation> dmarc = validateAsync(DnsRecordType.DMARC, target, smtpHost, selector);
        CompletableFuture<DnsRecordValidation> mx = validateAsync(DnsRecordType.MX, target, smtpHost, selector);
        CompletableFuture.allOf(spf, dkim, dmarc, mx).join();

        List<DnsRecordValidation> records = List.of(spf.join(), dkim.join(), dmarc.join(), mx.join());
        int overallScore = calculateScore(records);
        List<String> instructions = generator.setupInstructions(target, selector, spf.join(), dkim.join(), dmarc.join(), mx.join());

        log.info("DNS validation completed. domain={}, score={}, issues={}", target, overallScore,
                records.stream().mapToInt(r -> r.issues().size()).sum());
        return new DomainSetupGuide(target, spf.join(), dkim.join(), dmarc.join(), mx.join(), overallScore, instructions);
    }

    /**
     * Starts the check of one record type; the returned future always completes normally.
     */
    public CompletableFuture<DnsRecordValidation> validateAsync(DnsRecordType type, String domain, String smtpHost, String dkimSelector) {
        String target = normalizeDomain(domain);
        Supplier<DnsRecordValidation> task = switch (type) {
            case SPF -> () -> validateSpf(target, smtpHost);
            case DKIM -> () -> validateDkim(target, dkimSelector);
            case DMARC -> () -> validateDmarc(target);
            case MX -> () -> validateMx(target);
        };
        return CompletableFuture.supplyAsync(task, executor)
                .exceptionally(ex -> lookupFailed(target, type, unwrap(ex)));
    }

    public DnsRecordValidation validateSpf(String domain, String smtpHost) {
        String target = normalizeDomain(domain);
        try {
            String spfRecord = resolver.txt(target).valuesOrThrow(target, "TXT").stream()
                    .filter(record -> record.toLowerCase(Locale.ROOT).contains("v=spf1"))
                    .findFirst()
                    .orElse(null);

            if (spfRecord == null) {
                return invalid(target, DnsRecordType.SPF, null, generator.spfRecord(smtpHost), List.of("No SPF record found"));
            }
            if (!hasAllMechanism(spfRecord)) {
                return invalid(target, DnsRecordType.SPF, spfRecord, generator.spfRecord(smtpHost),
                        List.of("SPF record is missing an 'all' mechanism"));
            }
            if (!coversHost(spfRecord, smtpHost)) {
                return invalid(target, DnsRecordType.SPF, spfRecord, generator.spfRecord(smtpHost), List.of(SPF_HOST_ISSUE));
            }
            return valid(target, DnsRecordType.SPF, spfRecord, List.of());
        } catch (DnsLookupException e) {
            return lookupFailed(target, DnsRecordType.SPF, e);
        }
    }

    public DnsRecordValidation validateDkim(String domain, String selector) {
        String target = normalizeDomain(domain);
        String effectiveSelector = selector == null || selector.isBlank() ? defaultDkimSelector : selector.trim();
        String name = DnsRecordGenerator.dkimRecordName(effectiveSelector, target);
        try {
            List<String> records = resolver.txt(name).valuesOrThrow(name, "TXT");
            if (records.isEmpty()) {
                return invalid(target, DnsRecordType.DKIM, null, generator.dkimRecord(),
                        List.of("No DKIM record found for selector '" + effectiveSelector + "'"));
            }

            String dkimRecord = records.stream()
                    .filter(record -> record.toLowerCase(Locale.ROOT).contains("v=dkim1"))
                    .findFirst()
                    .orElse(null);
            if (dkimRecord == null) {
                return invalid(target, DnsRecordType.DKIM, records.get(0), generator.dkimRecord(),
                        List.of("DKIM record missing version tag (v=DKIM1)"));
            }

            String publicKey = parseTags(dkimRecord).get("p");
            if (publicKey == null || publicKey.isEmpty()) {
                return invalid(target, DnsRecordType.DKIM, dkimRecord, generator.dkimRecord(),
                        List.of("DKIM record missing public key (p= parameter)"));
            }
            return valid(target, DnsRecordType.DKIM, dkimRecord, List.of());
        } catch (DnsLookupException e) {
            return lookupFailed(target, DnsRecordType.DKIM, e);
        }
    }

    public DnsRecordValidation validateDmarc(String domain) {
        String target = normalizeDomain(domain);
        String name = DnsRecordGenerator.dmarcRecordName(target);
        try {
            List<String> records = resolver.txt(name).valuesOrThrow(name, "TXT");
            if (records.isEmpty()) {
                return invalid(target, DnsRecordType.DMARC, null, generator.dmarcRecord(target), List.of("No DMARC record found"));
            }

            String dmarcRecord = records.stream()
                    .filter(record -> record.toLowerCase(Locale.ROOT).contains("v=dmarc1"))
                    .findFirst()
                    .orElse(null);
            if (dmarcRecord == null) {
                return invalid(target, DnsRecordType.DMARC, records.get(0), generator.dmarcRecord(target),
                        List.of("DMARC record missing version tag (v=DMARC1)"));
            }

            String policy = parseTags(dmarcRecord).get("p");
            if (policy == null || policy.isEmpty()) {
                return invalid(target, DnsRecordType.DMARC, dmarcRecord, generator.dmarcRecord(target),
                        List.of("DMARC record missing policy (p= parameter)"));
            }

            List<String> advisories = new ArrayList<>();
            if ("none".equalsIgnoreCase(policy)) {
                advisories.add("DMARC policy is set to \"none\" - consider using \"quarantine\" or \"reject\"");
            }
            return valid(target, DnsRecordType.DMARC, dmarcRecord, advisories);
        } catch (DnsLookupException e) {
            return lookupFailed(target, DnsRecordType.DMARC, e);
        }
    }

    public DnsRecordValidation validateMx(String domain) {
        String target = normalizeDomain(domain);
        try {
            List<MxHost> hosts = resolver.mx(target).valuesOrThrow(target, "MX");
            if (hosts.isEmpty()) {
                return invalid(target, DnsRecordType.MX, null, generator.mxRecord(),
                        List.of("No MX records found - this domain cannot receive email"));
            }

            String currentValue = hosts.stream()
                    .map(host -> host.priority() + " " + host.exchange())
                    .collect(Collectors.joining(", "));
            List<String> advisories = new ArrayList<>();
            if (hosts.size() == 1 && hosts.get(0).priority() != 10) {
                advisories.add("Consider using priority 10 for your primary MX record");
            }
            return valid(target, DnsRecordType.MX, currentValue, advisories);
        } catch (DnsLookupException e) {
            return lookupFailed(target, DnsRecordType.MX, e);
        }
    }

    /**
     * Weighted sum of the record contributions, rounded to the nearest integer.
     */
    public static int calculateScore(List<DnsRecordValidation> records) {
        double total = 0;
        for (DnsRecordValidation record : records) {
            total += record.scoreContribution();
        }
        return (int) Math.max(0, Math.min(100, Math.round(total)));
    }

    static boolean hasAllMechanism(String spfRecord) {
        for (String token : spfRecord.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
            String mechanism = token;
            if (!mechanism.isEmpty() && "+-~?".indexOf(mechanism.charAt(0)) >= 0) {
                mechanism = mechanism.substring(1);
            }
            if (mechanism.equals("all")) {
                return true;
            }
        }
        return false;
    }

    private static boolean coversHost(String spfRecord, String smtpHost) {
        if (smtpHost == null || smtpHost.isBlank()) {
            return true;
        }
        String record = spfRecord.toLowerCase(Locale.ROOT);
        return record.contains(smtpHost.trim().toLowerCase(Locale.ROOT)) || record.contains("include:") || record.contains("a:");
    }

    static Map<String, String> parseTags(String record) {
        Map<String, String> tags = new HashMap<>();
        if (record == null || record.isBlank()) {
            return tags;
        }
        for (String token : record.split(";")) {
            String t = token.trim();
            int idx = t.indexOf('=');
            if (idx <= 0) {
                continue;
            }
            String key = t.substring(0, idx).trim().toLowerCase(Locale.ROOT);
            String value = t.substring(idx + 1).replaceAll("\\s+", "");
            tags.putIfAbsent(key, value);
        }
        return tags;
    }

    private DnsRecordValidation valid(String domain, DnsRecordType type, String currentValue, List<String> advisories) {
        return new DnsRecordValidation(domain, type, true, currentValue, null, advisories, clock.instant());
    }

    private DnsRecordValidation invalid(String domain, DnsRecordType type, String currentValue, String recommendedValue,
                                        List<String> issues) {
        return new DnsRecordValidation(domain, type, false, currentValue, recommendedValue, issues, clock.instant());
    }

    private DnsRecordValidation lookupFailed(String domain, DnsRecordType type, Throwable cause) {
        log.warn("{} validation failed. domain={}, message={}", type, domain, cause.getMessage());
        String recommended = switch (type) {
            case SPF -> generator.spfRecord(null);
            case DKIM -> generator.dkimRecord();
            case DMARC -> generator.dmarcRecord(domain);
            case MX -> generator.mxRecord();
        };
        return invalid(domain, type, null, recommended, List.of("DNS lookup failed: " + cause.getMessage()));
    }

    private static Throwable unwrap(Throwable ex) {
        if (ex instanceof CompletionException && ex.getCause() != null) {
            return ex.getCause();
        }
        return ex;
    }

    private static String normalizeDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank");
        }
        String normalized = domain.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
