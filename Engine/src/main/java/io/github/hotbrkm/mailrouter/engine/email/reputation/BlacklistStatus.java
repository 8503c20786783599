package io.github.hotbrkm.mailrouter.engine.email.reputation;

import java.time.Instant;

/**
 * @param provider the DNSBL zone that was queried
 */
public record BlacklistStatus(String domain, String provider, BlacklistState status, Instant lastChecked) {

    public boolean isListed() {
        return status == BlacklistState.LISTED;
    }

    public boolean isClean() {
        return status == BlacklistState.CLEAN;
    }
}
