package com.flagship.settlement_engine.marketplace;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
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
 * JPA entity for a registered participant.
 *
 * Identity and display name never change after registration. The pending
 * balance only moves through {@link #credit(BigInteger)} and {@link #drainPending()}.
 */
@Entity
@Table(name = "participants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ParticipantEntity implements Persistable<String> {

    @Id
    @Column(nullable = false, updatable = false, length = 42)
    private String identity;

    @Column(name = "display_name", nullable = false, updatable = false, unique = true, length = 64)
    private String displayName;

    @Column(name = "pending_balance", nullable = false, precision = 78, scale = 0)
    private BigInteger pendingBalance;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Transient
    private boolean newRecord = true;

    private ParticipantEntity(String identity, String displayName, Instant registeredAt) {
        this.identity = identity;
        this.displayName = displayName;
        this.pendingBalance = BigInteger.ZERO;
        this.registeredAt = registeredAt;
    }

    static ParticipantEntity register(String identity, String displayName, Instant registeredAt) {
        return new ParticipantEntity(identity, displayName, registeredAt);
    }

    void credit(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Cannot credit a negative amount: " + amount);
        }
        this.pendingBalance = this.pendingBalance.add(amount);
    }

    /**
     * Zeroes the pending balance.
     *
     * @return the amount that was pending
     */
    BigInteger drainPending() {
        BigInteger drained = this.pendingBalance;
        this.pendingBalance = BigInteger.ZERO;
        return drained;
    }

    @Override
    public String getId() {
        return identity;
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

    public Participant toDomain() {
        return new Participant(identity, displayName, pendingBalance, registeredAt);
    }
}
