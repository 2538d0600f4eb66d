package com.corebank.ledger.repository;

import com.corebank.ledger.domain.TransactionEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Immutable, append-only ledger legs.
 *
 * 1. findByGroupIdOrderByCreatedAtAsc
 *    All legs of one group, in the order they were applied.
 *
 * 2. findByAccountIdAndVirtualLegFalseOrderByCreatedAtDesc
 *    Customer-facing history: real legs only, newest first. Virtual offsetting
 *    legs share the account id but never moved its balance.
 *
 * 3. sumByGroupAndType
 *    Used by reconciliation checks: debits and credits of a group must match.
 */
@Repository
public interface TransactionEntryRepository extends JpaRepository<TransactionEntry, UUID> {

    List<TransactionEntry> findByGroupIdOrderByCreatedAtAsc(UUID groupId);

    Page<TransactionEntry> findByAccountIdAndVirtualLegFalseOrderByCreatedAtDesc(UUID accountId, Pageable pageable);

    long countByAccountIdAndVirtualLegFalse(UUID accountId);

    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM TransactionEntry e " +
           "WHERE e.group.id = :groupId AND e.entryType = :entryType")
    BigDecimal sumByGroupAndType(@Param("groupId") UUID groupId,
                                 @Param("entryType") TransactionEntry.EntryType entryType);
}
