package com.corebank.ledger.service;

import com.corebank.ledger.domain.TransactionEntry;
import com.corebank.ledger.domain.TransactionGroup;

import java.util.List;
import java.util.UUID;

/**
 * A written transaction group together with its legs, in application order.
 */
public final class BalancedTransaction {

    private final TransactionGroup group;
    private final List<TransactionEntry> entries;

    public BalancedTransaction(TransactionGroup group, List<TransactionEntry> entries) {
        this.group = group;
        this.entries = List.copyOf(entries);
    }

    public TransactionGroup getGroup() {
        return group;
    }

    public List<TransactionEntry> getEntries() {
        return entries;
    }

    /**
     * The first leg that actually moved the given account's balance.
     */
    public TransactionEntry realEntryFor(UUID accountId) {
        return entries.stream()
                .filter(e -> !e.isVirtualLeg() && e.getAccountId().equals(accountId))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "Group " + group.getId() + " has no real leg on account " + accountId));
    }
}
