package com.corebank.ledger.domain;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One debit or credit leg of a {@link TransactionGroup}.
 *
 * CRITICAL FINANCIAL RULES:
 * 1. Entries are IMMUTABLE and APPEND-ONLY
 * 2. amount is always positive; direction is carried by entryType
 * 3. balanceAfter snapshots the account balance right after this leg was applied
 * 4. A virtual leg offsets a deposit/withdrawal/investment movement against the
 *    same account without touching its balance, so balanceAfter is null
 */
@Entity
@Table(
    name = "transaction_entries",
    indexes = {
        @Index(name = "idx_entries_group_id", columnList = "group_id"),
        @Index(name = "idx_entries_account_created", columnList = "account_id,created_at")
    }
)
public class TransactionEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "group_id", nullable = false, updatable = false)
    private TransactionGroup group;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 10, updatable = false)
    private EntryType entryType;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    @Column(name = "balance_after", precision = 19, scale = 4, updatable = false)
    private BigDecimal balanceAfter;

    @Column(name = "virtual_leg", nullable = false, updatable = false)
    private boolean virtualLeg;

    @Column(length = 500, updatable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum EntryType {
        DEBIT,
        CREDIT
    }

    private TransactionEntry() {
    }

    public TransactionEntry(TransactionGroup group, UUID accountId, EntryType entryType,
                            BigDecimal amount, BigDecimal balanceAfter, boolean virtualLeg,
                            String description) {
        if (group == null) {
            throw new IllegalArgumentException("Group cannot be null");
        }
        if (accountId == null) {
            throw new IllegalArgumentException("Account cannot be null");
        }
        if (entryType == null) {
            throw new IllegalArgumentException("Entry type cannot be null");
        }
        if (!Amounts.isPositive(amount)) {
            throw new IllegalArgumentException("Entry amount must be positive");
        }
        if (virtualLeg && balanceAfter != null) {
            throw new IllegalArgumentException("Virtual legs carry no balance snapshot");
        }
        this.group = group;
        this.accountId = accountId;
        this.entryType = entryType;
        this.amount = Amounts.money(amount);
        this.balanceAfter = balanceAfter;
        this.virtualLeg = virtualLeg;
        this.description = description;
        this.createdAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public TransactionGroup getGroup() {
        return group;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public EntryType getEntryType() {
        return entryType;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getBalanceAfter() {
        return balanceAfter;
    }

    public boolean isVirtualLeg() {
        return virtualLeg;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isDebit() {
        return entryType == EntryType.DEBIT;
    }

    public boolean isCredit() {
        return entryType == EntryType.CREDIT;
    }

    /**
     * Amount with the sign it applies to the account: negative for debits.
     */
    public BigDecimal getSignedAmount() {
        return isDebit() ? amount.negate() : amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransactionEntry that = (TransactionEntry) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TransactionEntry{" +
                "id=" + id +
                ", groupId=" + (group != null ? group.getId() : null) +
                ", accountId=" + accountId +
                ", entryType=" + entryType +
                ", amount=" + amount +
                ", balanceAfter=" + balanceAfter +
                ", virtualLeg=" + virtualLeg +
                '}';
    }
}
