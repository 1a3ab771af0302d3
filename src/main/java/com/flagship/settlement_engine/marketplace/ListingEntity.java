package com.flagship.settlement_engine.marketplace;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigInteger;
import java.time.Instant;

/**
 * JPA entity for a marketplace listing.
 *
 * Ids are assigned by the marketplace (1, 2, 3, ...), not by the database.
 * A listing is sold at most once: {@link #markSold} refuses an unavailable item.
 */
@Entity
@Table(
    name = "listings",
    indexes = {
        @Index(name = "idx_listings_seller", columnList = "seller")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ListingEntity implements Persistable<Long> {

    @Id
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(nullable = false, updatable = false, columnDefinition = "text")
    private String description;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger price;

    @Column(nullable = false, updatable = false, length = 42)
    private String seller;

    @Column(nullable = false, length = 42)
    private String owner;

    @Column(nullable = false)
    private boolean available;

    @Column(name = "listed_at", nullable = false, updatable = false)
    private Instant listedAt;

    @Column(name = "sold_at")
    private Instant soldAt;

    @Transient
    private boolean newRecord = true;

    private ListingEntity(Long id, String name, String description, BigInteger price,
                          String seller, Instant listedAt) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.price = price;
        this.seller = seller;
        this.owner = seller;
        this.available = true;
        this.listedAt = listedAt;
    }

    static ListingEntity list(long id, String name, String description, BigInteger price,
                              String seller, Instant listedAt) {
        return new ListingEntity(id, name, description, price, seller, listedAt);
    }

    void markSold(String buyer, Instant soldAt) {
        if (!available) {
            throw new IllegalStateException("Listing " + id + " was already sold");
        }
        this.available = false;
        this.owner = buyer;
        this.soldAt = soldAt;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newRecord = false;
    }

    public Listing toDomain() {
        return new Listing(id, name, description, price, seller, owner, available, listedAt, soldAt);
    }
}
