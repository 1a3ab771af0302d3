package com.flagship.settlement_engine.transfer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default transfer primitive backed by the in-database asset ledger.
 *
 * Because the asset ledger shares the engine's database, a rolled-back
 * operation also undoes every transfer it made.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerAssetTransferGateway implements AssetTransferGateway {

    private final AssetLedgerService assetLedgerService;

    @Override
    public boolean transfer(TransferLeg leg, String operator) {
        return assetLedgerService.transfer(leg, operator)
            .map(transferId -> {
                log.debug("Asset transfer recorded: transferId={}, asset={}, amount={}",
                        transferId, leg.getAsset(), leg.getAmount());
                return true;
            })
            .orElse(false);
    }
}
