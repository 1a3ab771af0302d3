package com.flagship.settlement_engine.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - settlement.operations: Counter of operations by name and outcome
 * - settlement.latency: Timer of operation duration by name
 * - settlement.rejections: Counter of rejected operations by error code
 * - settlement.reentrancy.blocked: Counter of blocked re-entrant calls
 * - settlement.transfer.legs: Counter of transfer legs by outcome
 * - escrow.pending.total: Gauge of native asset owed to participants,
 *   refreshed by {@link MetricsScheduler}
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;
    private final AtomicReference<BigInteger> escrowPending = new AtomicReference<>(BigInteger.ZERO);

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("escrow.pending.total", escrowPending, ref -> ref.get().doubleValue())
                .description("Native asset owed to participants from pooled escrow")
                .register(registry);
    }

    /**
     * Records an operation outcome, e.g. ("execute_swap", "success").
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("settlement.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("settlement.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordRejection(String operation, String error) {
        registry.counter("settlement.rejections",
                "operation", sanitizeTag(operation),
                "error", sanitizeTag(error)
        ).increment();
    }

    public void recordReentrancyBlocked(String operation) {
        registry.counter("settlement.reentrancy.blocked",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordTransferLeg(int legIndex, boolean succeeded) {
        registry.counter("settlement.transfer.legs",
                "leg", String.valueOf(legIndex),
                "outcome", succeeded ? "success" : "failure"
        ).increment();
    }

    public void updateEscrowPending(BigInteger totalPending) {
        escrowPending.set(totalPending);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
