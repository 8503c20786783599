package io.github.hotbrkm.mailrouter.engine.email.tracking;

import io.github.hotbrkm.mailrouter.engine.email.store.EmailEvent;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailEventType;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailRecord;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailRecordStore;
import io.github.hotbrkm.mailrouter.engine.email.store.EmailStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Appends provider delivery events to email records. These events feed the deliverability score.
 */
@Slf4j
public class DeliveryEventRecorder {

    private static final Map<String, EmailEventType> SENDGRID_EVENT_TYPES = Map.of(
            "processed", EmailEventType.PROCESSED,
            "delivered", EmailEventType.DELIVERED,
            "deferred", EmailEventType.DEFERRED,
            "dropped", EmailEventType.DROPPED,
            "bounce", EmailEventType.BOUNCED,
            "open", EmailEventType.OPENED,
            "click", EmailEventType.CLICKED,
            "spamreport", EmailEventType.SPAM_REPORT,
            "unsubscribe", EmailEventType.UNSUBSCRIBE);

    private final EmailRecordStore recordStore;
    private final Clock clock;

    public DeliveryEventRecorder(EmailRecordStore recordStore, Clock clock) {
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Appends an event observed now. {@code DELIVERED} and {@code BOUNCED} also move the record's status.
     *
     * @return the updated record, empty when no email has the id
     */
    public Optional<EmailRecord> record(String emailId, EmailEventType type, String detail) {
        return record(emailId, new EmailEvent(type, clock.instant(), detail));
    }

    public Optional<EmailRecord> record(String emailId, EmailEvent event) {
        Optional<EmailRecord> updated = recordStore.update(emailId, r -> apply(r, event));
        if (updated.isEmpty()) {
            log.warn("Delivery event for unknown email. emailId={}, type={}", emailId, event.type());
        } else {
            log.debug("Delivery event recorded. emailId={}, type={}", emailId, event.type());
        }
        return updated;
    }

    /**
     * Applies a SendGrid webhook batch. Events are matched to emails by provider message id.
     */
    public IngestSummary ingestSendGridEvents(List<SendGridEvent> events) {
        int applied = 0;
        int skipped = 0;
        for (SendGridEvent event : events) {
            String providerMessageId = event.providerMessageId();
            Optional<EmailRecord> target = providerMessageId == null
                    ? Optional.empty()
                    : recordStore.findByProviderMessageId(providerMessageId);
            if (target.isEmpty()) {
                skipped++;
                log.debug("Skipping SendGrid event without a matching email. event={}, sgMessageId={}",
                        event.event(), event.sgMessageId());
                continue;
            }

            Instant occurredAt = event.timestamp() == null ? clock.instant() : Instant.ofEpochSecond(event.timestamp());
            record(target.get().id(), new EmailEvent(mapSendGridEvent(event.event()), occurredAt, event.reason()));
            applied++;
        }
        log.info("SendGrid events ingested. applied={}, skipped={}", applied, skipped);
        return new IngestSummary(applied, skipped);
    }

    /**
     * Unknown SendGrid event names map to {@link EmailEventType#PROCESSED}.
     */
    public static EmailEventType mapSendGridEvent(String eventName) {
        if (eventName == null) {
            return EmailEventType.PROCESSED;
        }
        return SENDGRID_EVENT_TYPES.getOrDefault(eventName.toLowerCase(Locale.ROOT), EmailEventType.PROCESSED);
    }

    private static EmailRecord apply(EmailRecord record, EmailEvent event) {
        EmailRecord appended = record.withEvent(event);
        if (event.type() == EmailEventType.DELIVERED) {
            return appended.withStatus(EmailStatus.DELIVERED);
        }
        if (event.type() == EmailEventType.BOUNCED) {
            return appended.withStatus(EmailStatus.BOUNCED);
        }
        return appended;
    }
}
