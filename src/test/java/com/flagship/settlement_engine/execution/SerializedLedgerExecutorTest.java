package com.flagship.settlement_engine.execution;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SerializedLedgerExecutorTest {

    private PlatformTransactionManager transactionManager;
    private SerializedLedgerExecutor executor;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any(TransactionDefinition.class)))
            .thenAnswer(invocation -> new SimpleTransactionStatus());
        executor = new SerializedLedgerExecutor(transactionManager);
    }

    @Test
    @DisplayName("Top-level operation commits its own transaction")
    void testExecute_CommitsOnSuccess() {
        String result = executor.execute("listItem", () -> {
            assertTrue(executor.inOperation());
            return "listed";
        });

        assertEquals("listed", result);
        assertFalse(executor.inOperation());
        verify(transactionManager, times(1)).getTransaction(any());
        verify(transactionManager, times(1)).commit(any(TransactionStatus.class));
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    @DisplayName("Failure rolls back and releases the lock")
    void testExecute_RollsBackOnFailure() {
        assertThrows(IllegalStateException.class, () -> executor.execute("buyItem", () -> {
            throw new IllegalStateException("leg failed");
        }));

        verify(transactionManager).rollback(any(TransactionStatus.class));
        verify(transactionManager, never()).commit(any());
        assertFalse(executor.inOperation());
    }

    @Test
    @DisplayName("Nested call joins the running operation without a new transaction")
    void testExecute_NestedCallJoins() {
        List<String> trace = new ArrayList<>();

        executor.run("executeSwap", () -> {
            trace.add("outer");
            RuntimeException nested = assertThrows(RuntimeException.class, () ->
                executor.run("withdraw", () -> {
                    trace.add("inner");
                    throw new RuntimeException("inner rejected");
                }));
            trace.add("caught " + nested.getMessage());
        });

        assertEquals(List.of("outer", "inner", "caught inner rejected"), trace);
        verify(transactionManager, times(1)).getTransaction(any());
        verify(transactionManager, times(1)).commit(any());
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    @DisplayName("Operations from different threads never overlap")
    void testExecute_SerializesThreads() throws Exception {
        int threads = 8;
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                executor.run("registerParticipant", () -> {
                    int now = running.incrementAndGet();
                    maxRunning.accumulateAndGet(now, Math::max);
                    try {
                        Thread.sleep(5);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    running.decrementAndGet();
                });
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(1, maxRunning.get());
        verify(transactionManager, times(threads)).commit(any());
    }
}
