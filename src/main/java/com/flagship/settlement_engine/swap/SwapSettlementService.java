package com.flagship.settlement_engine.swap;

import com.flagship.settlement_engine.authorization.AuthorizationVerifier;
import com.flagship.settlement_engine.authorization.OrderDigest;
import com.flagship.settlement_engine.authorization.OrderFingerprintService;
import com.flagship.settlement_engine.authorization.SwapOrder;
import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.error.SettlementError;
import com.flagship.settlement_engine.error.SettlementException;
import com.flagship.settlement_engine.execution.ReentrancyGuard;
import com.flagship.settlement_engine.execution.SerializedLedgerExecutor;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.swap.event.SwapCancelledEvent;
import com.flagship.settlement_engine.swap.event.SwapExecutedEvent;
import com.flagship.settlement_engine.transfer.AtomicTransferExecutor;
import com.flagship.settlement_engine.transfer.TransferLeg;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Settles signed bilateral swap orders.
 *
 * Each order fingerprint moves at most once from UNSEEN to either EXECUTED
 * or CANCELLED. The outcome row is written and flushed before any asset
 * moves, so a transfer gateway calling back in already sees the order as
 * settled; the re-entrancy guard rejects the callback before that matters.
 *
 * Every operation runs inside {@link SerializedLedgerExecutor}: one
 * transaction, one operation at a time. A failed leg rolls back the
 * outcome row, the other leg and the outbox event together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SwapSettlementService {

    private static final Pattern FINGERPRINT = Pattern.compile("^0x[0-9a-f]{64}$");

    private final AuthorizationVerifier verifier;
    private final OrderFingerprintService fingerprintService;
    private final SettlementRecordRepository recordRepository;
    private final AtomicTransferExecutor transferExecutor;
    private final OutboxService outboxService;
    private final SerializedLedgerExecutor ledgerExecutor;
    private final ReentrancyGuard reentrancyGuard;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Executes a swap on behalf of its counterparty.
     *
     * Checks, first failure wins: re-entry, initiator signature, expiry,
     * caller is the counterparty, fingerprint still UNSEEN. Then records
     * EXECUTED and moves leg A (initiator to counterparty) followed by
     * leg B (counterparty to initiator).
     *
     * @throws SettlementException on any rejected check or failed leg
     */
    public SwapSettlement executeSwap(SwapOrder order, String signature, String caller) {
        String fingerprint = fingerprintService.fingerprint(order);
        return tracked("execute_swap", fingerprint, () ->
            ledgerExecutor.execute("executeSwap", () ->
                reentrancyGuard.nonReentrant("executeSwap", () ->
                    doExecute(order, signature, caller, fingerprint))));
    }

    /**
     * Cancels a swap on behalf of its initiator. Expired orders may still be cancelled.
     *
     * @throws SettlementException on any rejected check
     */
    public SwapSettlement cancelSwap(SwapOrder order, String signature, String caller) {
        String fingerprint = fingerprintService.fingerprint(order);
        return tracked("cancel_swap", fingerprint, () ->
            ledgerExecutor.execute("cancelSwap", () ->
                reentrancyGuard.nonReentrant("cancelSwap", () ->
                    doCancel(order, signature, caller, fingerprint))));
    }

    public SwapSettlement status(String fingerprint) {
        if (fingerprint == null || !FINGERPRINT.matcher(fingerprint.toLowerCase()).matches()) {
            throw new IllegalArgumentException("Fingerprint must be 32 bytes of 0x-prefixed hex: " + fingerprint);
        }
        String key = fingerprint.toLowerCase();
        return recordRepository.findById(key)
            .map(SettlementRecordEntity::toDomain)
            .orElseGet(() -> SwapSettlement.unseen(key));
    }

    /**
     * Settled orders of one initiator, oldest first. Orders never settled have no record.
     */
    public List<SwapSettlement> settlementsByInitiator(String initiator) {
        return recordRepository.findByInitiatorOrderBySettledAtAsc(Addresses.normalize(initiator))
            .stream()
            .map(SettlementRecordEntity::toDomain)
            .toList();
    }

    /**
     * Fingerprint and signing hash for an order, for clients preparing a signature.
     */
    public OrderDigest digest(SwapOrder order) {
        return verifier.digest(order);
    }

    private SwapSettlement doExecute(SwapOrder order, String signature, String caller, String fingerprint) {
        verifier.requireSignedBy(order, signature, order.getInitiator());

        Instant now = clock.instant();
        if (order.isExpiredAt(now.getEpochSecond())) {
            throw SettlementException.of(SettlementError.EXPIRED,
                "Swap expired at " + order.getExpiry() + ", now " + now.getEpochSecond());
        }
        if (!Addresses.sameIdentity(caller, order.getCounterparty())) {
            throw SettlementException.of(SettlementError.UNAUTHORIZED_CALLER, "Only counterparty can execute");
        }
        requireUnseen(fingerprint);

        SettlementRecordEntity record = recordRepository.saveAndFlush(
            SettlementRecordEntity.executed(fingerprint, order, Addresses.normalize(caller), now));

        String operator = verifier.getDomain().getVerifyingContract();
        transferExecutor.execute(List.of(
            TransferLeg.of(order.getAssetA(), order.getInitiator(), order.getCounterparty(), order.getAmountA()),
            TransferLeg.of(order.getAssetB(), order.getCounterparty(), order.getInitiator(), order.getAmountB())
        ), operator);

        outboxService.record(SwapExecutedEvent.of(fingerprint, order, now));
        return record.toDomain();
    }

    private SwapSettlement doCancel(SwapOrder order, String signature, String caller, String fingerprint) {
        verifier.requireSignedBy(order, signature, order.getInitiator());

        if (!Addresses.sameIdentity(caller, order.getInitiator())) {
            throw SettlementException.of(SettlementError.UNAUTHORIZED_CALLER, "Only initiator can cancel");
        }
        requireUnseen(fingerprint);

        Instant now = clock.instant();
        SettlementRecordEntity record = recordRepository.saveAndFlush(
            SettlementRecordEntity.cancelled(fingerprint, order, Addresses.normalize(caller), now));

        outboxService.record(SwapCancelledEvent.of(fingerprint, order, now));
        return record.toDomain();
    }

    private void requireUnseen(String fingerprint) {
        recordRepository.findById(fingerprint).ifPresent(existing -> {
            String message = existing.getStatus() == SettlementStatus.CANCELLED
                ? "Swap has been cancelled"
                : "Swap has already been executed";
            throw SettlementException.of(SettlementError.ALREADY_SETTLED, message);
        });
    }

    private SwapSettlement tracked(String operation, String fingerprint, Supplier<SwapSettlement> body) {
        long startTime = System.currentTimeMillis();
        String previousFingerprint = MDC.get(CorrelationContext.FINGERPRINT_MDC_KEY);
        MDC.put(CorrelationContext.FINGERPRINT_MDC_KEY, fingerprint);
        try {
            SwapSettlement settlement = body.get();
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, "success");
            metrics.recordLatency(operation, duration);
            log.info("Swap {}: status={}, duration={}ms", operation, settlement.getStatus(), duration);
            return settlement;
        } catch (SettlementException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, "rejected");
            metrics.recordRejection(operation, e.getError().name());
            metrics.recordLatency(operation, duration);
            log.warn("Swap {} rejected: error={}, message={}, duration={}ms",
                    operation, e.getError(), e.getMessage(), duration);
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, "error");
            log.error("Swap {} failed unexpectedly: {}", operation, e.getMessage(), e);
            throw e;
        } finally {
            if (previousFingerprint == null) {
                MDC.remove(CorrelationContext.FINGERPRINT_MDC_KEY);
            } else {
                MDC.put(CorrelationContext.FINGERPRINT_MDC_KEY, previousFingerprint);
            }
        }
    }
}
