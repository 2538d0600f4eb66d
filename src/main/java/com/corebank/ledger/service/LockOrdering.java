package com.corebank.ledger.service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global acquisition order for account row locks.
 *
 * Every unit of work that locks more than one account locks them in the order
 * returned here, whatever their debit/credit role. Two transfers A→B and B→A
 * therefore both lock min(A,B) first and can never wait on each other in a
 * cycle.
 *
 * The order is the lexicographic order of the canonical string form. UUID's
 * own compareTo uses signed 64-bit halves and does not agree with it.
 */
public final class LockOrdering {

    private static final Comparator<UUID> CANONICAL = Comparator.comparing(UUID::toString);

    private LockOrdering() {
    }

    /**
     * @return the distinct, non-null ids in lock acquisition order
     */
    public static List<UUID> sorted(Collection<UUID> accountIds) {
        return accountIds.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted(CANONICAL)
                .collect(Collectors.toList());
    }
}
