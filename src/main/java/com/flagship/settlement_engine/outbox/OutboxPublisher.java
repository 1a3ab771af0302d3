package com.flagship.settlement_engine.outbox;

import com.flagship.settlement_engine.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Drains the outbox to Kafka.
 *
 * Swap events go to the swaps topic, participant and listing events to the
 * marketplace topic. The aggregate id is the record key, so the events of
 * one fingerprint, identity or listing stay ordered on one partition.
 *
 * Each send waits for the broker's ack before the next one starts. A failed
 * send bumps the event's retry count; at the limit the event is no longer
 * selected and is counted as dead-lettered.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.swaps:settlement.swaps}")
    private String swapsTopic;

    @Value("${kafka.topic.marketplace:settlement.marketplace}")
    private String marketplaceTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    /**
     * Publishes one batch.
     *
     * @return how many events reached Kafka
     */
    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public int publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findPublishableEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not read the outbox, retrying on the next tick", e);
            return 0;
        }

        int published = 0;
        for (OutboxEvent event : batch) {
            if (publish(event)) {
                published++;
            }
        }
        if (!batch.isEmpty()) {
            log.debug("Outbox batch done: published={}, failed={}", published, batch.size() - published);
        }
        return published;
    }

    /**
     * Publishes outside the schedule, e.g. right after a test wrote events.
     */
    public int triggerPublish() {
        return publishPendingEvents();
    }

    String topicFor(String aggregateType) {
        return switch (aggregateType) {
            case "Swap" -> swapsTopic;
            case "Participant", "Listing" -> marketplaceTopic;
            default -> throw new IllegalArgumentException("No topic for aggregate type: " + aggregateType);
        };
    }

    private boolean publish(OutboxEvent event) {
        try {
            RecordMetadata metadata = kafkaTemplate
                    .send(topicFor(event.getAggregateType()), event.getAggregateId(), event.getPayload())
                    .get()
                    .getRecordMetadata();

            outboxService.markPublished(event.getId());
            outboxMetrics.recordPublished(event.getEventType());
            log.debug("Published {} {}: topic={}, partition={}, offset={}", event.getEventType(), event.getId(),
                    metadata.topic(), metadata.partition(), metadata.offset());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "Interrupted while publishing");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(event, cause.getMessage());
        } catch (RuntimeException e) {
            recordFailure(event, e.getMessage());
        }
        return false;
    }

    private void recordFailure(OutboxEvent event, String reason) {
        log.error("Failed to publish {} {} for {}/{}: {}", event.getEventType(), event.getId(),
                event.getAggregateType(), event.getAggregateId(), reason);
        outboxService.markFailed(event.getId(), reason);
        outboxMetrics.recordPublishFailed(event.getEventType());

        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Outbox event {} reached {} attempts and is dead-lettered", event.getId(), maxRetries);
            outboxMetrics.recordDeadLettered(event.getEventType());
        }
    }
}
