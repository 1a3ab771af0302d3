package com.flagship.settlement_engine.swap;

import com.flagship.settlement_engine.authorization.SwapOrder;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * Persisted outcome of a swap, keyed by the order's fingerprint.
 *
 * One row per fingerprint, holding either EXECUTED or CANCELLED, so the two
 * outcomes exclude each other at the primary key. Rows are insert-only:
 * no setters, and {@link #isNew()} makes every save an INSERT, so a second
 * outcome for the same fingerprint fails on the key instead of overwriting.
 */
@Entity
@Table(name = "settlement_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SettlementRecordEntity implements Persistable<String> {

    @Id
    @Column(nullable = false, updatable = false, length = 66)
    private String fingerprint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private SettlementStatus status;

    @Column(name = "order_id", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger orderId;

    @Column(nullable = false, updatable = false, length = 42)
    private String initiator;

    @Column(nullable = false, updatable = false, length = 42)
    private String counterparty;

    @Column(name = "settled_by", nullable = false, updatable = false, length = 42)
    private String settledBy;

    @Column(name = "settled_at", nullable = false, updatable = false)
    private Instant settledAt;

    @Transient
    private boolean newRecord = true;

    private SettlementRecordEntity(String fingerprint, SettlementStatus status, SwapOrder order,
                                   String settledBy, Instant settledAt) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Only terminal outcomes are recorded, got " + status);
        }
        this.fingerprint = fingerprint;
        this.status = status;
        this.orderId = order.getId();
        this.initiator = order.getInitiator();
        this.counterparty = order.getCounterparty();
        this.settledBy = settledBy;
        this.settledAt = settledAt;
    }

    static SettlementRecordEntity executed(String fingerprint, SwapOrder order, String caller, Instant at) {
        return new SettlementRecordEntity(fingerprint, SettlementStatus.EXECUTED, order, caller, at);
    }

    static SettlementRecordEntity cancelled(String fingerprint, SwapOrder order, String caller, Instant at) {
        return new SettlementRecordEntity(fingerprint, SettlementStatus.CANCELLED, order, caller, at);
    }

    @Override
    public String getId() {
        return fingerprint;
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

    public SwapSettlement toDomain() {
        return new SwapSettlement(fingerprint, status, orderId, initiator, counterparty, settledBy, settledAt);
    }
}
