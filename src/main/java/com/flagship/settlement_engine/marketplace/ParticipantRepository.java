package com.flagship.settlement_engine.marketplace;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.Optional;

@Repository
public interface ParticipantRepository extends JpaRepository<ParticipantEntity, String> {

    boolean existsByDisplayName(String displayName);

    /**
     * Total native asset owed to all participants.
     */
    @Query("SELECT SUM(p.pendingBalance) FROM ParticipantEntity p")
    Optional<BigInteger> sumPendingBalances();
}
