package com.corebank.ledger.service;

import com.corebank.ledger.domain.TransactionEntry;
import com.corebank.ledger.domain.TransactionGroup;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Customer-facing view of one movement: the real leg on the caller's account
 * plus the kind and status of the group it belongs to.
 */
public final class MovementRecord {

    private final UUID groupId;
    private final UUID entryId;
    private final UUID accountId;
    private final TransactionGroup.Kind kind;
    private final TransactionEntry.EntryType entryType;
    private final BigDecimal amount;
    private final BigDecimal balanceAfter;
    private final String description;
    private final TransactionGroup.Status status;
    private final Instant timestamp;

    private MovementRecord(TransactionGroup group, TransactionEntry entry) {
        this.groupId = group.getId();
        this.entryId = entry.getId();
        this.accountId = entry.getAccountId();
        this.kind = group.getKind();
        this.entryType = entry.getEntryType();
        this.amount = entry.getAmount();
        this.balanceAfter = entry.getBalanceAfter();
        this.description = entry.getDescription();
        this.status = group.getStatus();
        this.timestamp = entry.getCreatedAt();
    }

    public static MovementRecord of(TransactionGroup group, TransactionEntry entry) {
        return new MovementRecord(group, entry);
    }

    public UUID getGroupId() {
        return groupId;
    }

    public UUID getEntryId() {
        return entryId;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public TransactionGroup.Kind getKind() {
        return kind;
    }

    public TransactionEntry.EntryType getEntryType() {
        return entryType;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getBalanceAfter() {
        return balanceAfter;
    }

    public String getDescription() {
        return description;
    }

    public TransactionGroup.Status getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "MovementRecord{" +
                "groupId=" + groupId +
                ", accountId=" + accountId +
                ", kind=" + kind +
                ", entryType=" + entryType +
                ", amount=" + amount +
                ", balanceAfter=" + balanceAfter +
                '}';
    }
}
