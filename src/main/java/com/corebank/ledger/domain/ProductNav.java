package com.corebank.ledger.domain;

import com.corebank.ledger.exception.ValidationException;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Net asset value of a product on one date. The most recent date is the
 * current unit price.
 */
@Entity
@Table(
    name = "product_navs",
    uniqueConstraints = @UniqueConstraint(name = "uk_product_navs_product_date",
                                          columnNames = {"product_id", "nav_date"})
)
public class ProductNav {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Column(name = "nav_date", nullable = false, updatable = false)
    private LocalDate navDate;

    @Column(name = "unit_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal unitPrice;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ProductNav() {
    }

    public ProductNav(UUID productId, LocalDate navDate, BigDecimal unitPrice) {
        if (productId == null || navDate == null) {
            throw new IllegalArgumentException("Product and date are required");
        }
        this.productId = productId;
        this.navDate = navDate;
        reprice(unitPrice);
    }

    public UUID getId() {
        return id;
    }

    public UUID getProductId() {
        return productId;
    }

    public LocalDate getNavDate() {
        return navDate;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void reprice(BigDecimal unitPrice) {
        if (unitPrice == null || !Amounts.isPositive(Amounts.price(unitPrice))) {
            throw new ValidationException("Unit price must be positive, got " + unitPrice);
        }
        this.unitPrice = Amounts.price(unitPrice);
        this.updatedAt = Instant.now();
    }
}
