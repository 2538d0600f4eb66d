package com.corebank.ledger.repository;

import com.corebank.ledger.domain.Account;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account Store.
 *
 * Locking contract:
 * - findByIdForUpdate is the ONLY way the ledger engine reads an account it is
 *   about to mutate. It issues SELECT ... FOR UPDATE and the row stays locked
 *   until the enclosing transaction commits or rolls back.
 *   EXAMPLE:
 *     - Tx A locks account (balance = 100)
 *     - Tx B attempts to lock same account → WAITS
 *     - Tx A debits 50 → COMMITS
 *     - Tx B acquires lock and sees balance 50
 * - Callers that lock several accounts must do so in LockOrdering order.
 * - Code that later locks an account in the same transaction must not have
 *   loaded it unlocked first: the persistence context would hand back the
 *   stale instance. Use existsByIdAndOwnerId for pre-lock ownership checks.
 *
 * No @Transactional here; services own the unit of work.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Account a WHERE a.id = :accountId")
    Optional<Account> findByIdForUpdate(@Param("accountId") UUID accountId);

    Optional<Account> findByAccountNumber(String accountNumber);

    boolean existsByAccountNumber(String accountNumber);

    boolean existsByIdAndOwnerId(UUID id, UUID ownerId);

    List<Account> findByOwnerIdOrderByCreatedAtAsc(UUID ownerId);

    long countByOwnerId(UUID ownerId);

    boolean existsByOwnerIdAndAccountType(UUID ownerId, Account.AccountType accountType);

    @Query("SELECT COALESCE(SUM(a.balance), 0) FROM Account a WHERE a.ownerId = :ownerId")
    BigDecimal sumBalanceByOwnerId(@Param("ownerId") UUID ownerId);
}
