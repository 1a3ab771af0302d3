package com.flagship.settlement_engine.transfer;

import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.transfer.dto.AllowanceResponse;
import com.flagship.settlement_engine.transfer.dto.ApproveRequest;
import com.flagship.settlement_engine.transfer.dto.BalanceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.flagship.settlement_engine.observability.CorrelationContext.CALLER_HEADER;

/**
 * Read access to asset balances and the journal, and allowance management.
 *
 * Allowances are always granted by the caller. Swaps need each party to
 * approve the verifying contract for the amount it is giving up.
 */
@RestController
@RequestMapping("/api/assets/{asset}")
@RequiredArgsConstructor
public class AssetController {

    private final AssetLedgerService assetLedgerService;

    @GetMapping("/balances/{holder}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("asset") String asset,
                                                      @PathVariable("holder") String holder) {
        return ResponseEntity.ok(new BalanceResponse(
            Addresses.normalize(asset), Addresses.normalize(holder), assetLedgerService.balanceOf(asset, holder)));
    }

    @GetMapping("/allowances/{owner}/{spender}")
    public ResponseEntity<AllowanceResponse> getAllowance(@PathVariable("asset") String asset,
                                                          @PathVariable("owner") String owner,
                                                          @PathVariable("spender") String spender) {
        return ResponseEntity.ok(new AllowanceResponse(
            Addresses.normalize(asset), Addresses.normalize(owner), Addresses.normalize(spender),
            assetLedgerService.allowance(asset, owner, spender)));
    }

    @PostMapping("/allowances")
    public ResponseEntity<AllowanceResponse> approve(@PathVariable("asset") String asset,
                                                     @Valid @RequestBody ApproveRequest request,
                                                     @RequestHeader(CALLER_HEADER) String caller) {
        assetLedgerService.approve(asset, caller, request.getSpender(), request.getAmount());
        return ResponseEntity.ok(new AllowanceResponse(
            Addresses.normalize(asset), Addresses.normalize(caller), Addresses.normalize(request.getSpender()),
            assetLedgerService.allowance(asset, caller, request.getSpender())));
    }

    @GetMapping("/entries/{holder}")
    public ResponseEntity<List<LedgerEntry>> getEntries(@PathVariable("asset") String asset,
                                                        @PathVariable("holder") String holder) {
        return ResponseEntity.ok(assetLedgerService.getLedgerEntriesForHolder(asset, holder));
    }
}
