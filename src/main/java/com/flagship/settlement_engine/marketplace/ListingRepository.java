package com.flagship.settlement_engine.marketplace;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ListingRepository extends JpaRepository<ListingEntity, Long> {

    @Query("SELECT MAX(l.id) FROM ListingEntity l")
    Optional<Long> findMaxId();

    List<ListingEntity> findBySellerOrderByIdAsc(String seller);
}
