package io.github.hotbrkm.mailrouter.engine.email.reputation;

import io.github.hotbrkm.mailrouter.engine.email.config.DeliveryProperties;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordType;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordValidation;
import io.github.hotbrkm.mailrouter.engine.email.dns.DnsRecordValidator;
import io.github.hotbrkm.mailrouter.engine.email.domain.EmailAddressUtil;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailRecordStore;
import io.github.hotbrkm.mailrouter.engine.email.tenant.ConfigurationException;
import io.github.hotbrkm.mailrouter.engine.email.tenant.DkimSettings;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SmtpConfig;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantConfigStore;
import io.github.hotbrkm.mailrouter.engine.email.tenant.TenantEmailConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Scores a tenant's sender reputation from its delivery history and its domain's DNS and block list posture.
 * <p>
 * {@code score = delivery * 0.4 + domain * 0.3 + compliance * 0.3}, clamped to [0, 100], where
 * delivery is {@code 100 - 2 * bounceRate - 5 * complaintRate}, domain is the trust score and compliance
 * gives 25 points per valid SPF, DKIM, DMARC and MX record. Weights come from {@link DeliveryProperties.Scoring}.
 */
@Slf4j
public class DeliverabilityScorer {

    private static final List<String> OPTIMAL_SENDING_TIMES = List.of(
            "09:00-11:00 Tuesday-Thursday",
            "14:00-16:00 Tuesday-Thursday",
            "10:00-12:00 Monday,Friday");

    private static final List<WarmupStep> WARMUP_PLAN = List.of(
            new WarmupStep(1, 50, List.of("gmail.com", "outlook.com"), "Start with major providers, low volume"),
            new WarmupStep(3, 100, List.of("gmail.com", "outlook.com", "yahoo.com"), "Increase volume gradually"),
            new WarmupStep(7, 250, List.of("gmail.com", "outlook.com", "yahoo.com", "hotmail.com"),
                    "Add more providers, maintain engagement"),
            new WarmupStep(14, 500, List.of("*"), "Full volume to all domains"));

    private static final int POINTS_PER_RECORD = 20;
    private static final int COMPLIANCE_POINTS_PER_RECORD = 25;

    private final TenantConfigStore configStore;
    private final EmailRecordStore recordStore;
    private final DnsRecordValidator dnsValidator;
    private final BlacklistMonitor blacklistMonitor;
    private final DeliveryProperties.Scoring scoring;
    private final Clock clock;

    public DeliverabilityScorer(TenantConfigStore configStore, EmailRecordStore recordStore, DnsRecordValidator dnsValidator,
                                BlacklistMonitor blacklistMonitor, DeliveryProperties.Scoring scoring, Clock clock) {
        this.configStore = Objects.requireNonNull(configStore, "configStore must not be null");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
        this.dnsValidator = Objects.requireNonNull(dnsValidator, "dnsValidator must not be null");
        this.blacklistMonitor = Objects.requireNonNull(blacklistMonitor, "blacklistMonitor must not be null");
        this.scoring = Objects.requireNonNull(scoring, "scoring must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @throws ConfigurationException when the tenant has no email configuration
     */
    public ReputationMetrics getReputation(String tenantId) {
        TenantEmailConfig config = configStore.find(tenantId)
                .orElseThrow(() -> new ConfigurationException(tenantId, "No email settings found for tenant"));

        Instant since = clock.instant().minus(Duration.ofDays(scoring.getHistoryDays()));
        DeliveryRates rates = DeliveryRates.of(recordStore.findCreatedSince(tenantId, since));

        List<String> warnings = new ArrayList<>();
        String domain = config.fromDomain();
        DomainReputation domainReputation = EmailAddressUtil.INVALID.equals(domain)
                ? DomainReputation.unknown()
                : analyzeDomain(domain, dkimSelector(config), warnings);

        int score = reputationScore(rates, domainReputation);
        List<String> recommendations = recommendations(rates, domainReputation);
        warnings.addAll(0, criticalWarnings(rates, domainReputation));

        log.info("Reputation computed. tenantId={}, domain={}, sent={}, score={}", tenantId, domainReputation.domain(),
                rates.sent(), score);
        return new ReputationMetrics(rates.deliveryRate(), rates.bounceRate(), rates.complaintRate(), rates.unsubscribeRate(),
                rates.spamRate(), score, domainReputation, recommendations, warnings);
    }

    public DeliveryOptimization analyzeDeliveryOptimization(String tenantId) {
        ReputationMetrics metrics = getReputation(tenantId);
        int recommendedVolume = (int) Math.round(scoring.getBaseVolume() * metrics.reputationScore() / 100.0);
        List<WarmupStep> warmupPlan = metrics.reputationScore() > scoring.getWarmupThreshold() ? List.of() : WARMUP_PLAN;
        return new DeliveryOptimization(recommendedVolume, OPTIMAL_SENDING_TIMES, warmupPlan, contentOptimizations(metrics));
    }

    /**
     * Looks up the domain's records and block list status concurrently. Lookup failures become warnings.
     */
    DomainReputation analyzeDomain(String domain, String dkimSelector, List<String> warnings) {
        CompletableFuture<DnsRecordValidation> spf = dnsValidator.validateAsync(DnsRecordType.SPF, domain, null, dkimSelector);
        CompletableFuture<DnsRecordValidation> dkim = dnsValidator.validateAsync(DnsRecordType.DKIM, domain, null, dkimSelector);
        CompletableFuture<DnsRecordValidation> dmarc = dnsValidator.validateAsync(DnsRecordType.DMARC, domain, null, dkimSelector);
        CompletableFuture<DnsRecordValidation> mx = dnsValidator.validateAsync(DnsRecordType.MX, domain, null, dkimSelector);

        List<BlacklistStatus> blacklist;
        try {
            blacklist = blacklistMonitor.checkBlacklist(domain);
        } catch (RuntimeException e) {
            log.warn("Blacklist check failed. domain={}, message={}", domain, e.getMessage());
            warnings.add("Blacklist check failed for domain " + domain + ": " + e.getMessage());
            blacklist = List.of();
        }
        CompletableFuture.allOf(spf, dkim, dmarc, mx).join();

        for (DnsRecordValidation validation : List.of(spf.join(), dkim.join(), dmarc.join(), mx.join())) {
            validation.issues().stream()
                    .filter(issue -> issue.startsWith("DNS lookup failed"))
                    .forEach(issue -> warnings.add(validation.recordType() + " check incomplete for domain " + domain + ": " + issue));
        }
        List<String> unknownZones = blacklist.stream()
                .filter(s -> s.status() == BlacklistState.UNKNOWN)
                .map(BlacklistStatus::provider)
                .toList();
        if (!unknownZones.isEmpty()) {
            warnings.add("Blacklist status unknown for: " + String.join(", ", unknownZones));
        }

        List<String> mxRecords = mx.join().valid() ? exchanges(mx.join().currentValue()) : List.of();
        boolean hasSpf = spf.join().valid();
        boolean hasDkim = dkim.join().valid();
        boolean hasDmarc = dmarc.join().valid();
        int trustScore = trustScore(hasSpf, hasDkim, hasDmarc, !mxRecords.isEmpty(), blacklist);
        return new DomainReputation(domain, hasSpf, hasDkim, hasDmarc, mxRecords, blacklist, trustScore);
    }

    /**
     * 20 points per present record plus up to 20 for the share of clean block lists.
     */
    static int trustScore(boolean hasSpf, boolean hasDkim, boolean hasDmarc, boolean hasMx, List<BlacklistStatus> blacklist) {
        double score = (hasSpf ? POINTS_PER_RECORD : 0) + (hasDkim ? POINTS_PER_RECORD : 0)
                + (hasDmarc ? POINTS_PER_RECORD : 0) + (hasMx ? POINTS_PER_RECORD : 0);
        if (!blacklist.isEmpty()) {
            long clean = blacklist.stream().filter(BlacklistStatus::isClean).count();
            score += (double) clean / blacklist.size() * POINTS_PER_RECORD;
        }
        return (int) Math.round(score);
    }

    int reputationScore(DeliveryRates rates, DomainReputation domain) {
        double deliveryScore = Math.max(0, 100
                - rates.bounceRate() * scoring.getBouncePenaltyFactor()
                - rates.complaintRate() * scoring.getComplaintPenaltyFactor());
        int complianceScore = (domain.hasSPF() ? COMPLIANCE_POINTS_PER_RECORD : 0)
                + (domain.hasDKIM() ? COMPLIANCE_POINTS_PER_RECORD : 0)
                + (domain.hasDMARC() ? COMPLIANCE_POINTS_PER_RECORD : 0)
                + (domain.hasMX() ? COMPLIANCE_POINTS_PER_RECORD : 0);

        double score = deliveryScore * scoring.getDeliveryWeight()
                + domain.trustScore() * scoring.getDomainWeight()
                + complianceScore * scoring.getComplianceWeight();
        return (int) Math.round(Math.max(0, Math.min(100, score)));
    }

    private List<String> recommendations(DeliveryRates rates, DomainReputation domain) {
        List<String> recommendations = new ArrayList<>();
        if (!domain.hasSPF()) {
            recommendations.add("Add SPF record to your domain to improve deliverability");
        }
        if (!domain.hasDKIM()) {
            recommendations.add("Configure DKIM signing for email authentication");
        }
        if (!domain.hasDMARC()) {
            recommendations.add("Implement DMARC policy to protect against spoofing");
        }
        if (rates.bounceRate() > scoring.getBounceRecommendThreshold()) {
            recommendations.add("High bounce rate detected. Clean your email list and validate addresses");
        }
        if (rates.complaintRate() > scoring.getComplaintRecommendThreshold()) {
            recommendations.add("High complaint rate. Review email content and targeting");
        }
        if (rates.sent() > 0 && rates.deliveryRate() < scoring.getDeliveryRateRecommendThreshold()) {
            recommendations.add("Consider implementing email warmup process for better deliverability");
        }
        List<BlacklistStatus> listed = domain.listedOn();
        if (!listed.isEmpty()) {
            recommendations.add("Remove your IP from blacklists: "
                    + listed.stream().map(BlacklistStatus::provider).collect(Collectors.joining(", ")));
        }
        return recommendations;
    }

    private List<String> criticalWarnings(DeliveryRates rates, DomainReputation domain) {
        List<String> warnings = new ArrayList<>();
        if (rates.bounceRate() > scoring.getBounceCriticalThreshold()) {
            warnings.add("Critical bounce rate detected - immediate action required");
        }
        if (rates.complaintRate() > scoring.getComplaintCriticalThreshold()) {
            warnings.add("High spam complaint rate - risk of provider blocking");
        }
        if (!domain.listedOn().isEmpty()) {
            warnings.add("Domain or IP is blacklisted - emails may not be delivered");
        }
        return warnings;
    }

    private List<String> contentOptimizations(ReputationMetrics metrics) {
        List<String> optimizations = new ArrayList<>();
        if (metrics.complaintRate() > scoring.getComplaintRecommendThreshold()) {
            optimizations.add("Review subject lines for spam triggers");
            optimizations.add("Add clear unsubscribe links");
            optimizations.add("Improve content relevance and targeting");
        }
        if (metrics.bounceRate() > scoring.getBounceRecommendThreshold()) {
            optimizations.add("Implement email validation before sending");
            optimizations.add("Remove invalid addresses from lists");
        }
        return optimizations;
    }

    private static String dkimSelector(TenantEmailConfig config) {
        return config.smtpConfig()
                .map(SmtpConfig::dkim)
                .map(DkimSettings::selector)
                .filter(selector -> !selector.isBlank())
                .orElse(null);
    }

    // "10 mx1.example.com, 20 mx2.example.com" -> [mx1.example.com, mx2.example.com]
    private static List<String> exchanges(String mxValue) {
        if (mxValue == null || mxValue.isBlank()) {
            return List.of();
        }
        return Arrays.stream(mxValue.split(",\\s*"))
                .map(String::trim)
                .map(entry -> entry.substring(entry.indexOf(' ') + 1))
                .toList();
    }
}
