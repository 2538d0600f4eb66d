package com.corebank.ledger.service;

import com.corebank.ledger.domain.TransactionEntry.EntryType;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One requested leg of a balanced transaction.
 *
 * A virtual leg names the account it offsets but never touches that account's
 * balance; it carries no balance snapshot once written.
 */
public final class EntryRequest {

    private final UUID accountId;
    private final EntryType entryType;
    private final BigDecimal amount;
    private final String description;
    private final boolean virtual;

    private EntryRequest(UUID accountId, EntryType entryType, BigDecimal amount,
                         String description, boolean virtual) {
        this.accountId = accountId;
        this.entryType = entryType;
        this.amount = amount;
        this.description = description;
        this.virtual = virtual;
    }

    public static EntryRequest debit(UUID accountId, BigDecimal amount, String description) {
        return new EntryRequest(accountId, EntryType.DEBIT, amount, description, false);
    }

    public static EntryRequest credit(UUID accountId, BigDecimal amount, String description) {
        return new EntryRequest(accountId, EntryType.CREDIT, amount, description, false);
    }

    public static EntryRequest virtualDebit(UUID accountId, BigDecimal amount, String description) {
        return new EntryRequest(accountId, EntryType.DEBIT, amount, description, true);
    }

    public static EntryRequest virtualCredit(UUID accountId, BigDecimal amount, String description) {
        return new EntryRequest(accountId, EntryType.CREDIT, amount, description, true);
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

    public String getDescription() {
        return description;
    }

    public boolean isVirtual() {
        return virtual;
    }

    @Override
    public String toString() {
        return "EntryRequest{" +
                "accountId=" + accountId +
                ", entryType=" + entryType +
                ", amount=" + amount +
                ", virtual=" + virtual +
                '}';
    }
}
