package io.github.hotbrkm.mailrouter.engine.email.store;

public enum EmailStatus {
    DRAFT,
    SCHEDULED,
    SENT,
    DELIVERED,
    BOUNCED,
    FAILED;

    /**
     * True once the message has been accepted by a provider.
     */
    public boolean isHandedOff() {
        return this == SENT || this == DELIVERED || this == BOUNCED;
    }
}
