package io.github.hotbrkm.mailrouter.engine.email.store;

import io.github.hotbrkm.mailrouter.engine.email.send.result.ProviderUsed;
import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The delivery history of one email as kept by the host application's store.
 *
 * @param correlationId id the host application sent with the request, may be {@code null}
 * @param events        provider events in arrival order
 */
@Builder(toBuilder = true)
public record EmailRecord(String id,
                          String tenantId,
                          String correlationId,
                          String recipient,
                          String subject,
                          EmailStatus status,
                          ProviderUsed providerUsed,
                          String providerMessageId,
                          Instant sentAt,
                          String failureReason,
                          Instant createdAt,
                          List<EmailEvent> events) {

    public EmailRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        status = status == null ? EmailStatus.DRAFT : status;
        events = events == null ? List.of() : List.copyOf(events);
    }

    public EmailRecord sent(ProviderUsed provider, String messageId, Instant at) {
        return toBuilder()
                .status(EmailStatus.SENT)
                .providerUsed(provider)
                .providerMessageId(messageId)
                .sentAt(at)
                .failureReason(null)
                .build();
    }

    public EmailRecord failed(String reason) {
        return toBuilder()
                .status(EmailStatus.FAILED)
                .failureReason(reason)
                .build();
    }

    public EmailRecord withEvent(EmailEvent event) {
        List<EmailEvent> appended = new ArrayList<>(events);
        appended.add(event);
        return toBuilder().events(appended).build();
    }

    public EmailRecord withStatus(EmailStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public boolean hasEvent(EmailEventType type) {
        return events.stream().anyMatch(e -> e.type() == type);
    }
}
