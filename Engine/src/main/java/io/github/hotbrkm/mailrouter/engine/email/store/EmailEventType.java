package io.github.hotbrkm.mailrouter.engine.email.store;

public enum EmailEventType {
    PROCESSED,
    DELIVERED,
    DEFERRED,
    DROPPED,
    BOUNCED,
    OPENED,
    CLICKED,
    SPAM_REPORT,
    UNSUBSCRIBE
}
