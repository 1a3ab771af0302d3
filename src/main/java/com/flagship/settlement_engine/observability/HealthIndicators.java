package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.marketplace.EscrowService;
import com.flagship.settlement_engine.outbox.OutboxEventRepository;
import com.flagship.settlement_engine.transfer.AssetLedgerService;
import com.flagship.settlement_engine.transfer.EscrowAccount;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Custom health indicators for the settlement engine.
 */
public class HealthIndicators {

    /**
     * Publishing lag: UP below the warning backlog, WARNING below the
     * critical one, DOWN above it. Events stuck at the retry limit are
     * reported but do not change the status.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private final long warningBacklog;
        private final long criticalBacklog;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.health.warning-backlog:1000}") long warningBacklog,
                                     @Value("${outbox.health.critical-backlog:10000}") long criticalBacklog,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.warningBacklog = warningBacklog;
            this.criticalBacklog = criticalBacklog;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                Health.Builder builder;
                if (backlog < warningBacklog) {
                    builder = Health.up();
                } else if (backlog < criticalBacklog) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.down();
                }
                return builder
                        .withDetail("backlog", backlog)
                        .withDetail("stuck", outboxRepository
                                .countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries))
                        .withDetail("warningBacklog", warningBacklog)
                        .withDetail("criticalBacklog", criticalBacklog)
                        .build();
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Escrow solvency: the escrow account's native balance must cover
     * everything owed to participants.
     */
    @Component("escrowHealth")
    public static class EscrowHealthIndicator implements HealthIndicator {

        private final EscrowService escrowService;
        private final AssetLedgerService assetLedgerService;

        public EscrowHealthIndicator(EscrowService escrowService, AssetLedgerService assetLedgerService) {
            this.escrowService = escrowService;
            this.assetLedgerService = assetLedgerService;
        }

        @Override
        public Health health() {
            try {
                EscrowAccount account = escrowService.getEscrowAccount();
                BigInteger owed = escrowService.totalPending();
                BigInteger held = assetLedgerService.balanceOf(account.getNativeAsset(), account.getAddress());

                Health.Builder builder = held.compareTo(owed) >= 0 ? Health.up() : Health.down();
                return builder
                        .withDetail("escrowAccount", account.getAddress())
                        .withDetail("held", held.toString())
                        .withDetail("owed", owed.toString())
                        .build();

            } catch (RuntimeException e) {
                return Health.down(e).build();
            }
        }
    }
}
