package io.github.hotbrkm.mailrouter.engine.email.reputation;

public enum BlacklistState {
    CLEAN,
    LISTED,
    // Lookup failed or the domain has no IPv4 address
    UNKNOWN
}
