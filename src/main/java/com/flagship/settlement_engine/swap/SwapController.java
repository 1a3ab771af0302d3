package com.flagship.settlement_engine.swap;

import com.flagship.settlement_engine.authorization.SigningDomain;
import com.flagship.settlement_engine.swap.dto.SignedSwapRequest;
import com.flagship.settlement_engine.swap.dto.SwapDigestResponse;
import com.flagship.settlement_engine.swap.dto.SwapOrderPayload;
import com.flagship.settlement_engine.swap.dto.SwapSettlementResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.flagship.settlement_engine.observability.CorrelationContext.CALLER_HEADER;

/**
 * REST endpoints for swap settlement.
 *
 * The acting identity is taken from the X-Caller-Address header, which the
 * authenticating edge sets.
 */
@RestController
@RequestMapping("/api/swaps")
@RequiredArgsConstructor
@Slf4j
public class SwapController {

    private final SwapSettlementService settlementService;
    private final SigningDomain signingDomain;

    @PostMapping("/execute")
    public ResponseEntity<SwapSettlementResponse> executeSwap(
            @Valid @RequestBody SignedSwapRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        log.info("Received swap execution: orderId={}", request.getOrder().getId());
        SwapSettlement settlement = settlementService.executeSwap(
            request.getOrder().toOrder(), request.getSignature(), caller);
        return ResponseEntity.ok(SwapSettlementResponse.from(settlement));
    }

    @PostMapping("/cancel")
    public ResponseEntity<SwapSettlementResponse> cancelSwap(
            @Valid @RequestBody SignedSwapRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        log.info("Received swap cancellation: orderId={}", request.getOrder().getId());
        SwapSettlement settlement = settlementService.cancelSwap(
            request.getOrder().toOrder(), request.getSignature(), caller);
        return ResponseEntity.ok(SwapSettlementResponse.from(settlement));
    }

    @PostMapping("/digest")
    public ResponseEntity<SwapDigestResponse> digest(@Valid @RequestBody SwapOrderPayload order) {
        return ResponseEntity.ok(SwapDigestResponse.from(settlementService.digest(order.toOrder()), signingDomain));
    }

    @GetMapping("/{fingerprint}")
    public ResponseEntity<SwapSettlementResponse> getStatus(@PathVariable("fingerprint") String fingerprint) {
        return ResponseEntity.ok(SwapSettlementResponse.from(settlementService.status(fingerprint)));
    }

    @GetMapping
    public ResponseEntity<List<SwapSettlementResponse>> getSettlementsByInitiator(
            @RequestParam("initiator") String initiator) {
        return ResponseEntity.ok(settlementService.settlementsByInitiator(initiator).stream()
            .map(SwapSettlementResponse::from)
            .toList());
    }
}
