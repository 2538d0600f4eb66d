package com.corebank.ledger.repository;

import com.corebank.ledger.domain.InvestmentHolding;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Holdings follow the same per-row discipline as accounts: every mutation
 * goes through a *ForUpdate finder, and holding rows are locked only after
 * the account rows of the same unit of work.
 */
@Repository
public interface InvestmentHoldingRepository extends JpaRepository<InvestmentHolding, UUID> {

    /**
     * Unlocked projection used to find which account and product a holding
     * belongs to before any lock is taken. Does not load the entity, so a
     * later findByIdForUpdate in the same transaction reads fresh state.
     */
    interface HoldingRef {
        UUID getId();
        UUID getUserId();
        UUID getAccountId();
        UUID getProductId();
    }

    @Query("SELECT h.id AS id, h.userId AS userId, h.accountId AS accountId, h.productId AS productId " +
           "FROM InvestmentHolding h WHERE h.id = :holdingId")
    Optional<HoldingRef> findRefById(@Param("holdingId") UUID holdingId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM InvestmentHolding h WHERE h.id = :holdingId")
    Optional<InvestmentHolding> findByIdForUpdate(@Param("holdingId") UUID holdingId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM InvestmentHolding h WHERE h.activeKey = :activeKey")
    Optional<InvestmentHolding> findActiveByKeyForUpdate(@Param("activeKey") String activeKey);

    List<InvestmentHolding> findByUserIdOrderByPurchaseDateDesc(UUID userId);

    List<InvestmentHolding> findByUserIdAndStatus(UUID userId, InvestmentHolding.HoldingStatus status);
}
