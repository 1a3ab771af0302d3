package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox health as seen by the scraper.
 *
 * Metrics exposed:
 * - outbox.pending: Gauge of events not yet on Kafka
 * - outbox.pending.oldest.seconds: Gauge of how long the oldest of them has waited
 * - outbox.stuck: Gauge of events at the retry limit, no longer picked up
 * - outbox.publish: Counter of publish attempts by event type and outcome
 *   (published, failed, dead_lettered)
 *
 * The gauges hold values cached by {@link MetricsScheduler}.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry registry;
    private final Clock clock;
    private final int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong stuck = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry registry,
                         Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.registry = registry;
        this.clock = clock;
        this.maxRetries = maxRetries;

        Gauge.builder("outbox.pending", pending, AtomicLong::get)
                .description("Ledger events written but not yet published")
                .register(registry);
        Gauge.builder("outbox.pending.oldest.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("Wait time of the oldest unpublished ledger event")
                .register(registry);
        Gauge.builder("outbox.stuck", stuck, AtomicLong::get)
                .description("Unpublished ledger events at the retry limit")
                .register(registry);
    }

    @Transactional(readOnly = true)
    public void refresh() {
        try {
            pending.set(outboxRepository.countUnpublished());
            oldestPendingSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));
            stuck.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));

            log.debug("Outbox gauges: pending={}, oldest={}s, stuck={}",
                    pending.get(), oldestPendingSeconds.get(), stuck.get());
        } catch (RuntimeException e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordPublished(String eventType) {
        recordPublish(eventType, "published");
    }

    public void recordPublishFailed(String eventType) {
        recordPublish(eventType, "failed");
    }

    public void recordDeadLettered(String eventType) {
        recordPublish(eventType, "dead_lettered");
    }

    private void recordPublish(String eventType, String outcome) {
        registry.counter("outbox.publish", "event_type", eventType, "outcome", outcome).increment();
    }
}
