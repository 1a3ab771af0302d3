package com.flagship.settlement_engine.execution;

import com.flagship.settlement_engine.error.SettlementError;
import com.flagship.settlement_engine.error.SettlementException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Process-wide lock for operations that both mutate ledger state and call
 * into untrusted transfer code.
 *
 * Top-level operations are already serialized by {@link SerializedLedgerExecutor},
 * so the only way to find the lock held is a nested call made from inside
 * a running guarded operation, typically a transfer gateway calling back in.
 */
@Component
@Slf4j
public class ReentrancyGuard {

    private final AtomicBoolean entered = new AtomicBoolean(false);
    private final SettlementMetrics metrics;

    public ReentrancyGuard(SettlementMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Runs {@code body} holding the lock, releasing it on every exit path.
     *
     * @throws SettlementException REENTRANT_CALL if the lock is already held
     */
    public <T> T nonReentrant(String operation, Supplier<T> body) {
        if (!entered.compareAndSet(false, true)) {
            log.warn("Blocked re-entrant call into {}", operation);
            metrics.recordReentrancyBlocked(operation);
            throw SettlementException.of(SettlementError.REENTRANT_CALL,
                "Re-entrant call into " + operation + " while a guarded operation is running");
        }
        try {
            return body.get();
        } finally {
            entered.set(false);
        }
    }

    public boolean isHeld() {
        return entered.get();
    }
}
