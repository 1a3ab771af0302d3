package com.flagship.settlement_engine.marketplace;

import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.marketplace.dto.CreateListingRequest;
import com.flagship.settlement_engine.marketplace.dto.ListingResponse;
import com.flagship.settlement_engine.marketplace.dto.ParticipantResponse;
import com.flagship.settlement_engine.marketplace.dto.PurchaseRequest;
import com.flagship.settlement_engine.marketplace.dto.RegisterParticipantRequest;
import com.flagship.settlement_engine.marketplace.dto.WithdrawalResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

import static com.flagship.settlement_engine.observability.CorrelationContext.CALLER_HEADER;

/**
 * REST endpoints for participants, listings and escrow withdrawal.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class MarketplaceController {

    private final MarketplaceService marketplaceService;
    private final EscrowService escrowService;

    @PostMapping("/participants")
    public ResponseEntity<ParticipantResponse> registerParticipant(
            @Valid @RequestBody RegisterParticipantRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        Participant participant = marketplaceService.registerParticipant(caller, request.getDisplayName());
        return ResponseEntity.status(HttpStatus.CREATED).body(ParticipantResponse.from(participant));
    }

    @GetMapping("/participants/{identity}")
    public ResponseEntity<ParticipantResponse> getParticipant(@PathVariable("identity") String identity) {
        return marketplaceService.participant(identity)
            .map(participant -> ResponseEntity.ok(ParticipantResponse.from(participant)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/participants/{identity}/listings")
    public ResponseEntity<List<ListingResponse>> getListingsBySeller(@PathVariable("identity") String identity) {
        return ResponseEntity.ok(marketplaceService.listingsBySeller(identity).stream()
            .map(ListingResponse::from)
            .toList());
    }

    @PostMapping("/listings")
    public ResponseEntity<ListingResponse> listItem(
            @Valid @RequestBody CreateListingRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        Listing listing = marketplaceService.listItem(
            caller, request.getName(), request.getDescription(), request.getPrice());
        log.info("Listed item: id={}, price={}", listing.getId(), listing.getPrice());
        return ResponseEntity.status(HttpStatus.CREATED).body(ListingResponse.from(listing));
    }

    @GetMapping("/listings/{id}")
    public ResponseEntity<ListingResponse> getListing(@PathVariable("id") long id) {
        return marketplaceService.listing(id)
            .map(listing -> ResponseEntity.ok(ListingResponse.from(listing)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/listings/{id}/purchase")
    public ResponseEntity<ListingResponse> buyItem(
            @PathVariable("id") long id,
            @Valid @RequestBody PurchaseRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        Listing listing = marketplaceService.buyItem(caller, id, request.getPaymentAmount());
        return ResponseEntity.ok(ListingResponse.from(listing));
    }

    @PostMapping("/escrow/withdraw")
    public ResponseEntity<WithdrawalResponse> withdraw(@RequestHeader(CALLER_HEADER) String caller) {
        BigInteger amount = escrowService.withdraw(caller);
        return ResponseEntity.ok(new WithdrawalResponse(
            Addresses.normalize(caller), escrowService.getEscrowAccount().getNativeAsset(), amount));
    }
}
