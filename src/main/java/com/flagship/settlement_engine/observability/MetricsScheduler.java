package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.marketplace.EscrowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need database queries, so a scrape never does.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final SettlementMetrics settlementMetrics;
    private final EscrowService escrowService;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refresh();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshEscrowMetrics() {
        try {
            settlementMetrics.updateEscrowPending(escrowService.totalPending());
        } catch (RuntimeException e) {
            log.warn("Failed to refresh escrow metrics: {}", e.getMessage());
        }
    }
}
