package com.corebank.ledger.repository;

import com.corebank.ledger.domain.InvestmentTransaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface InvestmentTransactionRepository extends JpaRepository<InvestmentTransaction, UUID> {

    /**
     * A user's investment history, newest first. PortfolioService picks the
     * variant matching the filters it was given.
     */
    List<InvestmentTransaction> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    List<InvestmentTransaction> findByUserIdAndProductIdOrderByCreatedAtDesc(
            UUID userId, UUID productId, Pageable pageable);

    List<InvestmentTransaction> findByUserIdAndKindOrderByCreatedAtDesc(
            UUID userId, InvestmentTransaction.TransactionKind kind, Pageable pageable);

    List<InvestmentTransaction> findByUserIdAndProductIdAndKindOrderByCreatedAtDesc(
            UUID userId, UUID productId, InvestmentTransaction.TransactionKind kind, Pageable pageable);

    List<InvestmentTransaction> findByHoldingIdOrderByCreatedAtAsc(UUID holdingId);
}
