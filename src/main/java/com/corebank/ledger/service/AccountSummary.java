package com.corebank.ledger.service;

import java.math.BigDecimal;
import java.util.UUID;

public final class AccountSummary {

    private final UUID ownerId;
    private final long accountCount;
    private final BigDecimal totalBalance;

    public AccountSummary(UUID ownerId, long accountCount, BigDecimal totalBalance) {
        this.ownerId = ownerId;
        this.accountCount = accountCount;
        this.totalBalance = totalBalance;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public long getAccountCount() {
        return accountCount;
    }

    public BigDecimal getTotalBalance() {
        return totalBalance;
    }
}
