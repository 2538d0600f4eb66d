package com.corebank.ledger.domain;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Header of one logical money movement. Its legs are {@link TransactionEntry} rows.
 *
 * Written in the same unit of work as its entries and never updated afterwards;
 * corrections are new, offsetting groups.
 */
@Entity
@Table(
    name = "transaction_groups",
    indexes = {
        @Index(name = "idx_groups_kind", columnList = "kind"),
        @Index(name = "idx_groups_created_at", columnList = "created_at")
    }
)
public class TransactionGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30, updatable = false)
    private Kind kind;

    @Column(length = 500, updatable = false)
    private String description;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private Status status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false, updatable = false)
    private Instant updatedAt;

    public enum Kind {
        DEPOSIT,
        WITHDRAWAL,
        TRANSFER,
        INVESTMENT_PURCHASE,
        INVESTMENT_REDEMPTION
    }

    public enum Status {
        PENDING,
        COMPLETED,
        FAILED,
        CANCELLED
    }

    protected TransactionGroup() {
    }

    /**
     * Groups are only ever created once all legs have been validated and
     * applied, so they start out COMPLETED.
     */
    public TransactionGroup(Kind kind, String description, BigDecimal totalAmount) {
        if (kind == null) {
            throw new IllegalArgumentException("Group kind cannot be null");
        }
        if (!Amounts.isPositive(totalAmount)) {
            throw new IllegalArgumentException("Group total must be positive");
        }
        this.kind = kind;
        this.description = description;
        this.totalAmount = Amounts.money(totalAmount);
        this.status = Status.COMPLETED;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public UUID getId() {
        return id;
    }

    public Kind getKind() {
        return kind;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public Status getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransactionGroup that = (TransactionGroup) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TransactionGroup{" +
                "id=" + id +
                ", kind=" + kind +
                ", totalAmount=" + totalAmount +
                ", status=" + status +
                ", createdAt=" + createdAt +
                '}';
    }
}
