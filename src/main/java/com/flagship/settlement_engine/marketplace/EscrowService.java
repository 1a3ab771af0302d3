package com.flagship.settlement_engine.marketplace;

import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.error.SettlementError;
import com.flagship.settlement_engine.error.SettlementException;
import com.flagship.settlement_engine.execution.ReentrancyGuard;
import com.flagship.settlement_engine.execution.SerializedLedgerExecutor;
import com.flagship.settlement_engine.marketplace.event.FundsWithdrawnEvent;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.transfer.AssetTransferGateway;
import com.flagship.settlement_engine.transfer.EscrowAccount;
import com.flagship.settlement_engine.transfer.TransferLeg;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Pooled escrow of marketplace sale proceeds.
 *
 * Sales credit the seller's pending balance while the payment itself sits
 * in the escrow account. Withdrawal is pull-based: the balance is zeroed
 * and flushed first, then the native asset leaves escrow. If the payout
 * fails, the zeroing rolls back with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowService {

    private final ParticipantRepository participantRepository;
    private final AssetTransferGateway transferGateway;
    private final EscrowAccount escrowAccount;
    private final OutboxService outboxService;
    private final SerializedLedgerExecutor ledgerExecutor;
    private final ReentrancyGuard reentrancyGuard;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Adds sale proceeds to a participant's pending balance.
     * Runs inside the sale that produced them.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void credit(String identity, BigInteger amount) {
        ParticipantEntity participant = participantRepository.findById(Addresses.normalize(identity))
            .orElseThrow(() -> SettlementException.of(SettlementError.NOT_REGISTERED,
                "Cannot credit unregistered identity " + identity));
        participant.credit(amount);
        participantRepository.save(participant);
        log.debug("Escrow credited: identity={}, amount={}, pending={}",
                participant.getIdentity(), amount, participant.getPendingBalance());
    }

    /**
     * Pays out the caller's entire pending balance.
     *
     * @return the amount paid out
     * @throws SettlementException NOT_REGISTERED, NOTHING_TO_WITHDRAW,
     *         WITHDRAWAL_TRANSFER_FAILED or REENTRANT_CALL
     */
    public BigInteger withdraw(String caller) {
        long startTime = System.currentTimeMillis();
        try {
            BigInteger amount = ledgerExecutor.execute("withdraw", () ->
                reentrancyGuard.nonReentrant("withdraw", () -> doWithdraw(caller)));
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation("withdraw", "success");
            metrics.recordLatency("withdraw", duration);
            log.info("Escrow withdrawal: amount={}, duration={}ms", amount, duration);
            return amount;
        } catch (SettlementException e) {
            metrics.recordOperation("withdraw", "rejected");
            metrics.recordRejection("withdraw", e.getError().name());
            metrics.recordLatency("withdraw", System.currentTimeMillis() - startTime);
            log.warn("Escrow withdrawal rejected: error={}, message={}", e.getError(), e.getMessage());
            throw e;
        }
    }

    /**
     * Proceeds waiting for {@code identity}; zero for unknown identities.
     */
    public BigInteger pendingBalance(String identity) {
        return participantRepository.findById(Addresses.normalize(identity))
            .map(ParticipantEntity::getPendingBalance)
            .orElse(BigInteger.ZERO);
    }

    /**
     * Total owed to all participants. The escrow account's native balance must cover it.
     */
    public BigInteger totalPending() {
        return participantRepository.sumPendingBalances().orElse(BigInteger.ZERO);
    }

    public EscrowAccount getEscrowAccount() {
        return escrowAccount;
    }

    private BigInteger doWithdraw(String caller) {
        ParticipantEntity participant = findParticipant(caller)
            .orElseThrow(() -> SettlementException.of(SettlementError.NOT_REGISTERED, "User not registered"));

        if (participant.getPendingBalance().signum() == 0) {
            throw SettlementException.of(SettlementError.NOTHING_TO_WITHDRAW, "No funds to withdraw");
        }

        BigInteger amount = participant.drainPending();
        participantRepository.saveAndFlush(participant);

        TransferLeg payout = TransferLeg.of(
            escrowAccount.getNativeAsset(), escrowAccount.getAddress(), participant.getIdentity(), amount);
        boolean transferred;
        try {
            transferred = transferGateway.transfer(payout, escrowAccount.getAddress());
        } catch (RuntimeException e) {
            throw withdrawalFailed(amount, e);
        }
        if (!transferred) {
            throw withdrawalFailed(amount, null);
        }

        outboxService.record(FundsWithdrawnEvent.of(participant.getIdentity(), amount, clock.instant()));
        return amount;
    }

    private Optional<ParticipantEntity> findParticipant(String caller) {
        return Addresses.isValid(caller)
            ? participantRepository.findById(Addresses.normalize(caller))
            : Optional.empty();
    }

    private static SettlementException withdrawalFailed(BigInteger amount, Throwable cause) {
        String message = cause == null
            ? "Withdrawal transfer was declined"
            : "Withdrawal transfer failed: " + cause.getMessage();
        return new SettlementException(SettlementError.WITHDRAWAL_TRANSFER_FAILED, message,
            Map.of("amount", amount.toString()), cause);
    }
}
