package io.github.hotbrkm.mailrouter.engine.email.store;

import java.time.Instant;
import java.util.Objects;

/**
 * @param detail provider supplied reason or payload, may be {@code null}
 */
public record EmailEvent(EmailEventType type, Instant occurredAt, String detail) {

    public EmailEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }
}
