package com.flagship.settlement_engine.marketplace;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

/**
 * Map-backed repository mocks for marketplace service tests.
 */
class InMemoryMarketplaceStore {

    final Map<String, ParticipantEntity> participants = new TreeMap<>();
    final TreeMap<Long, ListingEntity> listings = new TreeMap<>();

    final ParticipantRepository participantRepository = mock(ParticipantRepository.class);
    final ListingRepository listingRepository = mock(ListingRepository.class);

    InMemoryMarketplaceStore() {
        lenient().when(participantRepository.findById(anyString()))
            .thenAnswer(invocation -> Optional.ofNullable(participants.get(invocation.<String>getArgument(0))));
        lenient().when(participantRepository.existsById(anyString()))
            .thenAnswer(invocation -> participants.containsKey(invocation.<String>getArgument(0)));
        lenient().when(participantRepository.existsByDisplayName(anyString()))
            .thenAnswer(invocation -> participants.values().stream()
                .anyMatch(p -> p.getDisplayName().equals(invocation.getArgument(0))));
        lenient().when(participantRepository.saveAndFlush(any(ParticipantEntity.class)))
            .thenAnswer(invocation -> saveParticipant(invocation.getArgument(0)));
        lenient().when(participantRepository.save(any(ParticipantEntity.class)))
            .thenAnswer(invocation -> saveParticipant(invocation.getArgument(0)));
        lenient().when(participantRepository.sumPendingBalances())
            .thenAnswer(invocation -> participants.isEmpty()
                ? Optional.empty()
                : Optional.of(participants.values().stream()
                    .map(ParticipantEntity::getPendingBalance)
                    .reduce(BigInteger.ZERO, BigInteger::add)));

        lenient().when(listingRepository.findById(anyLong()))
            .thenAnswer(invocation -> Optional.ofNullable(listings.get(invocation.<Long>getArgument(0))));
        lenient().when(listingRepository.findMaxId())
            .thenAnswer(invocation -> listings.isEmpty()
                ? Optional.empty()
                : Optional.of(listings.lastKey()));
        lenient().when(listingRepository.saveAndFlush(any(ListingEntity.class)))
            .thenAnswer(invocation -> {
                ListingEntity listing = invocation.getArgument(0);
                listings.put(listing.getId(), listing);
                return listing;
            });
    }

    private ParticipantEntity saveParticipant(ParticipantEntity participant) {
        participants.put(participant.getIdentity(), participant);
        return participant;
    }
}
