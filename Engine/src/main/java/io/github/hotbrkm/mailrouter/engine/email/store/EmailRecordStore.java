package io.github.hotbrkm.mailrouter.engine.email.store;

import io.github.hotbrkm.mailrouter.engine.email.send.result.ProviderUsed;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Email history owned by the host application. The engine only reads it and applies status transitions.
 */
public interface EmailRecordStore {

    EmailRecord save(EmailRecord record);

    Optional<EmailRecord> findById(String id);

    Optional<EmailRecord> findByCorrelationId(String tenantId, String correlationId);

    Optional<EmailRecord> findByProviderMessageId(String providerMessageId);

    /**
     * Records of the tenant created at or after {@code since}.
     */
    List<EmailRecord> findCreatedSince(String tenantId, Instant since);

    /**
     * Atomically replaces the record with the given id.
     *
     * @return the updated record, empty when no record has the id
     */
    Optional<EmailRecord> update(String id, UnaryOperator<EmailRecord> change);

    default Optional<EmailRecord> markSent(String id, ProviderUsed provider, String providerMessageId, Instant sentAt) {
        return update(id, r -> r.sent(provider, providerMessageId, sentAt));
    }

    default Optional<EmailRecord> markFailed(String id, String reason) {
        return update(id, r -> r.failed(reason));
    }

    default Optional<EmailRecord> appendEvent(String id, EmailEvent event) {
        return update(id, r -> r.withEvent(event));
    }
}
