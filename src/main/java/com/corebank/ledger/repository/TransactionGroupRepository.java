package com.corebank.ledger.repository;

import com.corebank.ledger.domain.TransactionGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Append-only store of transaction group headers. Callers only ever save new
 * groups; there are no update or delete paths.
 */
@Repository
public interface TransactionGroupRepository extends JpaRepository<TransactionGroup, UUID> {
}
