package com.flagship.settlement_engine.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.event.LedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Transactional outbox for ledger events.
 *
 * {@link #record} joins the ledger operation's transaction, so an event
 * exists exactly when the operation committed. {@link OutboxPublisher}
 * drains the table to Kafka; its bookkeeping runs in transactions of its
 * own so a failed send never touches ledger state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent record(LedgerEvent event) {
        OutboxEventEntity saved = repository.save(OutboxEventEntity.pending(event, toJson(event)));
        log.debug("Outbox event recorded: type={}, aggregate={}/{}",
                event.getEventType(), event.getAggregateType(), event.getAggregateId());
        return saved.toDomain();
    }

    /**
     * Next batch to publish, in sequence order. Rows are locked with SKIP
     * LOCKED, so concurrent publishers take disjoint batches.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishableEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        update(eventId, entity -> entity.markPublished(clock.instant()));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        update(eventId, entity -> {
            entity.markFailed(errorMessage);
            log.warn("Outbox event {} failed, attempt {}: {}", eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events of one fingerprint, identity or listing in the order they were recorded.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, String aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private void update(UUID eventId, Consumer<OutboxEventEntity> change) {
        repository.findById(eventId).ifPresentOrElse(entity -> {
            change.accept(entity);
            repository.save(entity);
        }, () -> log.warn("Outbox event {} vanished before its state could be updated", eventId));
    }

    private String toJson(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event.getEventType() + " event", e);
        }
    }
}
