package io.github.hotbrkm.mailrouter.engine.email.reputation;

import java.util.List;

/**
 * Authentication and block list posture of a sending domain.
 *
 * @param mxRecords  exchanges in priority order
 * @param trustScore 0-100
 */
public record DomainReputation(String domain,
                               boolean hasSPF,
                               boolean hasDKIM,
                               boolean hasDMARC,
                               List<String> mxRecords,
                               List<BlacklistStatus> blacklistStatus,
                               int trustScore) {

    public DomainReputation {
        mxRecords = mxRecords == null ? List.of() : List.copyOf(mxRecords);
        blacklistStatus = blacklistStatus == null ? List.of() : List.copyOf(blacklistStatus);
    }

    public static DomainReputation unknown() {
        return new DomainReputation("unknown", false, false, false, List.of(), List.of(), 0);
    }

    public boolean hasMX() {
        return !mxRecords.isEmpty();
    }

    public List<BlacklistStatus> listedOn() {
        return blacklistStatus.stream().filter(BlacklistStatus::isListed).toList();
    }
}
