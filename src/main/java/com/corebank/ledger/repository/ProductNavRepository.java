package com.corebank.ledger.repository;

import com.corebank.ledger.domain.ProductNav;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * NAV history, unique per (product, date). Read-only to the engines; only the
 * NAV recording path writes here.
 */
@Repository
public interface ProductNavRepository extends JpaRepository<ProductNav, UUID> {

    /**
     * Latest NAV by date: the authoritative current unit price.
     */
    Optional<ProductNav> findFirstByProductIdOrderByNavDateDesc(UUID productId);

    Optional<ProductNav> findByProductIdAndNavDate(UUID productId, LocalDate navDate);

    List<ProductNav> findByProductIdOrderByNavDateDesc(UUID productId);
}
