package com.flagship.settlement_engine.transfer;

import com.flagship.settlement_engine.error.SettlementException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Performs one or two transfer legs as a single logical unit.
 *
 * Legs run in list order (leg A at index 0 before leg B at index 1). The
 * first leg that is declined or throws aborts the operation with
 * TRANSFER_FAILED carrying that leg's index. Undoing the legs that already
 * ran is left to the enclosing ledger transaction, which must be active.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AtomicTransferExecutor {

    private static final int MAX_LEGS = 2;

    private final AssetTransferGateway gateway;
    private final SettlementMetrics metrics;

    /**
     * @throws SettlementException TRANSFER_FAILED(legIndex) on the first failing leg
     */
    public void execute(List<TransferLeg> legs, String operator) {
        if (legs == null || legs.isEmpty() || legs.size() > MAX_LEGS) {
            throw new IllegalArgumentException("A transfer takes one or two legs, got: "
                + (legs == null ? 0 : legs.size()));
        }

        for (int legIndex = 0; legIndex < legs.size(); legIndex++) {
            TransferLeg leg = legs.get(legIndex);
            boolean transferred;
            try {
                transferred = gateway.transfer(leg, operator);
            } catch (RuntimeException e) {
                metrics.recordTransferLeg(legIndex, false);
                log.warn("Transfer leg {} threw: asset={}, from={}, to={}, error={}",
                        legIndex, leg.getAsset(), leg.getFrom(), leg.getTo(), e.getMessage());
                throw SettlementException.transferFailed(legIndex, e);
            }

            metrics.recordTransferLeg(legIndex, transferred);
            if (!transferred) {
                log.warn("Transfer leg {} declined: asset={}, from={}, to={}, amount={}",
                        legIndex, leg.getAsset(), leg.getFrom(), leg.getTo(), leg.getAmount());
                throw SettlementException.transferFailed(legIndex, null);
            }
            log.debug("Transfer leg {} done: asset={}, amount={}", legIndex, leg.getAsset(), leg.getAmount());
        }
    }
}
