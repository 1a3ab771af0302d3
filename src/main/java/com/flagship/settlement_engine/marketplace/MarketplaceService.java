package com.flagship.settlement_engine.marketplace;

import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.common.Uint256;
import com.flagship.settlement_engine.error.SettlementError;
import com.flagship.settlement_engine.error.SettlementException;
import com.flagship.settlement_engine.execution.ReentrancyGuard;
import com.flagship.settlement_engine.execution.SerializedLedgerExecutor;
import com.flagship.settlement_engine.marketplace.event.ItemListedEvent;
import com.flagship.settlement_engine.marketplace.event.ItemSoldEvent;
import com.flagship.settlement_engine.marketplace.event.ParticipantRegisteredEvent;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.transfer.AtomicTransferExecutor;
import com.flagship.settlement_engine.transfer.EscrowAccount;
import com.flagship.settlement_engine.transfer.TransferLeg;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Fixed-price marketplace between registered participants.
 *
 * Buyers pay the exact price in the native asset into the escrow account;
 * the seller's share is credited to their pending balance and withdrawn
 * later through {@link EscrowService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketplaceService {

    static final int MAX_NAME_LENGTH = 64;

    private final ParticipantRepository participantRepository;
    private final ListingRepository listingRepository;
    private final EscrowService escrowService;
    private final EscrowAccount escrowAccount;
    private final AtomicTransferExecutor transferExecutor;
    private final OutboxService outboxService;
    private final SerializedLedgerExecutor ledgerExecutor;
    private final ReentrancyGuard reentrancyGuard;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Registers the caller under a unique display name.
     *
     * @throws IllegalArgumentException if the name is blank or longer than 64 characters
     * @throws SettlementException ALREADY_REGISTERED, then NAME_TAKEN
     */
    public Participant registerParticipant(String caller, String displayName) {
        String identity = Addresses.normalize(caller);
        if (displayName == null || displayName.isBlank() || displayName.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                "Display name must be 1 to " + MAX_NAME_LENGTH + " characters and not blank");
        }

        return tracked("register_participant", null, () -> ledgerExecutor.execute("registerParticipant", () -> {
            if (participantRepository.existsById(identity)) {
                throw SettlementException.of(SettlementError.ALREADY_REGISTERED, "User already registered");
            }
            if (participantRepository.existsByDisplayName(displayName)) {
                throw SettlementException.of(SettlementError.NAME_TAKEN, "Username already taken");
            }

            Participant participant = participantRepository.saveAndFlush(
                ParticipantEntity.register(identity, displayName, clock.instant())).toDomain();
            outboxService.record(ParticipantRegisteredEvent.from(participant));
            return participant;
        }));
    }

    /**
     * Lists an item owned by the caller. Ids start at 1 and increase by one per listing.
     *
     * @throws SettlementException NOT_REGISTERED, then INVALID_PRICE
     */
    public Listing listItem(String caller, String name, String description, BigInteger price) {
        if (name == null || price == null) {
            throw new IllegalArgumentException("Listing name and price are required");
        }

        return tracked("list_item", null, () -> ledgerExecutor.execute("listItem", () -> {
            ParticipantEntity seller = requireRegistered(caller);
            if (price.signum() <= 0 || !Uint256.isValid(price)) {
                throw SettlementException.of(SettlementError.INVALID_PRICE,
                    "Price must be greater than 0 and fit in 256 bits");
            }

            long id = listingRepository.findMaxId().orElse(0L) + 1;
            Listing listing = listingRepository.saveAndFlush(ListingEntity.list(
                id, name, description == null ? "" : description, price,
                seller.getIdentity(), clock.instant())).toDomain();
            outboxService.record(ItemListedEvent.from(listing));
            return listing;
        }));
    }

    /**
     * Buys a listing for exactly its price.
     *
     * The listing flips to sold and the seller is credited before the buyer's
     * payment is pulled into escrow; a failed payment rolls all of it back.
     *
     * @throws SettlementException REENTRANT_CALL, NOT_REGISTERED, ITEM_UNAVAILABLE,
     *         SELF_PURCHASE, WRONG_PAYMENT_AMOUNT or TRANSFER_FAILED(0)
     */
    public Listing buyItem(String caller, long listingId, BigInteger paymentAmount) {
        return tracked("buy_item", listingId, () -> ledgerExecutor.execute("buyItem", () ->
            reentrancyGuard.nonReentrant("buyItem", () -> doBuy(caller, listingId, paymentAmount))));
    }

    public Optional<Participant> participant(String identity) {
        if (!Addresses.isValid(identity)) {
            return Optional.empty();
        }
        return participantRepository.findById(Addresses.normalize(identity)).map(ParticipantEntity::toDomain);
    }

    public Optional<Listing> listing(long listingId) {
        return listingRepository.findById(listingId).map(ListingEntity::toDomain);
    }

    /**
     * Everything a seller has listed, sold items included, in listing order.
     */
    public List<Listing> listingsBySeller(String seller) {
        if (!Addresses.isValid(seller)) {
            return List.of();
        }
        return listingRepository.findBySellerOrderByIdAsc(Addresses.normalize(seller))
            .stream()
            .map(ListingEntity::toDomain)
            .toList();
    }

    private Listing doBuy(String caller, long listingId, BigInteger paymentAmount) {
        ParticipantEntity buyer = requireRegistered(caller);

        ListingEntity listing = listingRepository.findById(listingId)
            .filter(ListingEntity::isAvailable)
            .orElseThrow(() -> SettlementException.of(SettlementError.ITEM_UNAVAILABLE, "Item is not available"));

        if (listing.getOwner().equals(buyer.getIdentity())) {
            throw SettlementException.of(SettlementError.SELF_PURCHASE, "Cannot buy your own item");
        }
        if (paymentAmount == null || paymentAmount.compareTo(listing.getPrice()) != 0) {
            throw SettlementException.of(SettlementError.WRONG_PAYMENT_AMOUNT,
                "Payment must equal the price of " + listing.getPrice() + ", got " + paymentAmount);
        }

        String seller = listing.getOwner();
        Instant now = clock.instant();
        listing.markSold(buyer.getIdentity(), now);
        listingRepository.saveAndFlush(listing);
        escrowService.credit(seller, listing.getPrice());
        participantRepository.flush();

        transferExecutor.execute(List.of(TransferLeg.of(
            escrowAccount.getNativeAsset(), buyer.getIdentity(), escrowAccount.getAddress(), listing.getPrice()
        )), buyer.getIdentity());

        Listing sold = listing.toDomain();
        outboxService.record(ItemSoldEvent.from(sold));
        return sold;
    }

    private ParticipantEntity requireRegistered(String caller) {
        Optional<ParticipantEntity> participant = Addresses.isValid(caller)
            ? participantRepository.findById(Addresses.normalize(caller))
            : Optional.empty();
        return participant.orElseThrow(() ->
            SettlementException.of(SettlementError.NOT_REGISTERED, "User not registered"));
    }

    private <T> T tracked(String operation, Long listingId, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        String previousListing = MDC.get(CorrelationContext.LISTING_ID_MDC_KEY);
        if (listingId != null) {
            MDC.put(CorrelationContext.LISTING_ID_MDC_KEY, listingId.toString());
        }
        try {
            T result = body.get();
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, "success");
            metrics.recordLatency(operation, duration);
            log.info("Marketplace {} completed: duration={}ms", operation, duration);
            return result;
        } catch (SettlementException e) {
            metrics.recordOperation(operation, "rejected");
            metrics.recordRejection(operation, e.getError().name());
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            log.warn("Marketplace {} rejected: error={}, message={}", operation, e.getError(), e.getMessage());
            throw e;
        } finally {
            if (previousListing == null) {
                MDC.remove(CorrelationContext.LISTING_ID_MDC_KEY);
            } else {
                MDC.put(CorrelationContext.LISTING_ID_MDC_KEY, previousListing);
            }
        }
    }
}
