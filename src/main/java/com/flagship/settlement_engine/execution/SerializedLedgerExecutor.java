package com.flagship.settlement_engine.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs each state-mutating ledger operation as one indivisible unit.
 *
 * Top-level operations take a fair process-wide lock and run in their own
 * transaction, so they never interleave and either fully commit or fully
 * roll back. The lock is released only after commit or rollback.
 *
 * A call arriving on a thread that already holds the lock is a nested call
 * (a transfer gateway calling back in). It runs inside the caller's
 * transaction without a transaction boundary of its own: its exceptions
 * reach the caller directly instead of marking the outer transaction
 * rollback-only.
 */
@Component
@Slf4j
public class SerializedLedgerExecutor {

    private final ReentrantLock ledgerLock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public SerializedLedgerExecutor(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T execute(String operation, Supplier<T> body) {
        if (ledgerLock.isHeldByCurrentThread()) {
            log.debug("Nested call into {} joins the running operation", operation);
            return body.get();
        }

        ledgerLock.lock();
        try {
            return transactionTemplate.execute(status -> body.get());
        } finally {
            ledgerLock.unlock();
        }
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Whether the current thread is inside a running ledger operation.
     */
    public boolean inOperation() {
        return ledgerLock.isHeldByCurrentThread();
    }
}
