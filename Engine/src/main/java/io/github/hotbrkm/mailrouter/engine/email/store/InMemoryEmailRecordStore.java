package io.github.hotbrkm.mailrouter.engine.email.store;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Process-local store used when the host application registers no {@link EmailRecordStore}.
 */
public class InMemoryEmailRecordStore implements EmailRecordStore {

    private final Map<String, EmailRecord> records = new ConcurrentHashMap<>();

    @Override
    public EmailRecord save(EmailRecord record) {
        records.put(record.id(), record);
        return record;
    }

    @Override
    public Optional<EmailRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public Optional<EmailRecord> findByCorrelationId(String tenantId, String correlationId) {
        if (correlationId == null) {
            return Optional.empty();
        }
        return records.values().stream()
                .filter(r -> r.tenantId().equals(tenantId) && correlationId.equals(r.correlationId()))
                .findFirst();
    }

    @Override
    public Optional<EmailRecord> findByProviderMessageId(String providerMessageId) {
        if (providerMessageId == null) {
            return Optional.empty();
        }
        return records.values().stream()
                .filter(r -> providerMessageId.equals(r.providerMessageId()))
                .findFirst();
    }

    @Override
    public List<EmailRecord> findCreatedSince(String tenantId, Instant since) {
        return records.values().stream()
                .filter(r -> r.tenantId().equals(tenantId))
                .filter(r -> r.createdAt() != null && !r.createdAt().isBefore(since))
                .sorted(Comparator.comparing(EmailRecord::createdAt))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<EmailRecord> update(String id, UnaryOperator<EmailRecord> change) {
        Objects.requireNonNull(change, "change must not be null");
        return Optional.ofNullable(records.computeIfPresent(id, (k, r) -> change.apply(r)));
    }

    public int size() {
        return records.size();
    }
}
