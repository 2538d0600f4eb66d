package com.corebank.ledger.domain;

import com.corebank.ledger.exception.ValidationException;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Wealth-management product that can be bought in shares.
 */
@Entity
@Table(
    name = "investment_products",
    indexes = {
        @Index(name = "idx_products_code", columnList = "product_code", unique = true),
        @Index(name = "idx_products_type_active", columnList = "product_type,active")
    }
)
public class InvestmentProduct {

    private static final BigDecimal DEFAULT_MIN_INVESTMENT = new BigDecimal("1.0000");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "product_code", nullable = false, unique = true, length = 50, updatable = false)
    private String productCode;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_type", nullable = false, length = 20, updatable = false)
    private ProductType productType;

    /** 1 (very low) to 5 (very high). */
    @Column(name = "risk_level", nullable = false)
    private int riskLevel;

    @Column(name = "expected_return_rate", precision = 7, scale = 4)
    private BigDecimal expectedReturnRate;

    @Column(name = "min_investment_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal minInvestmentAmount;

    @Column(name = "max_investment_amount", precision = 19, scale = 4)
    private BigDecimal maxInvestmentAmount;

    /** Null for demand products. */
    @Column(name = "investment_period_days")
    private Integer investmentPeriodDays;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public enum ProductType {
        MONEY_FUND,
        FIXED_TERM,
        MUTUAL_FUND,
        INSURANCE
    }

    protected InvestmentProduct() {
    }

    public InvestmentProduct(String productCode, String name, ProductType productType, int riskLevel,
                             BigDecimal minInvestmentAmount, BigDecimal maxInvestmentAmount,
                             Integer investmentPeriodDays) {
        if (productCode == null || productCode.isBlank()) {
            throw new ValidationException("Product code is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Product name is required");
        }
        if (productType == null) {
            throw new ValidationException("Product type is required");
        }
        if (riskLevel < 1 || riskLevel > 5) {
            throw new ValidationException("Risk level must be between 1 and 5, got " + riskLevel);
        }
        BigDecimal min = minInvestmentAmount != null ? Amounts.money(minInvestmentAmount) : DEFAULT_MIN_INVESTMENT;
        if (!Amounts.isPositive(min)) {
            throw new ValidationException("Minimum investment amount must be positive");
        }
        if (maxInvestmentAmount != null && maxInvestmentAmount.compareTo(min) < 0) {
            throw new ValidationException("Maximum investment amount cannot be below the minimum");
        }
        if (investmentPeriodDays != null && investmentPeriodDays <= 0) {
            throw new ValidationException("Investment period must be positive");
        }
        this.productCode = productCode;
        this.name = name;
        this.productType = productType;
        this.riskLevel = riskLevel;
        this.minInvestmentAmount = min;
        this.maxInvestmentAmount = maxInvestmentAmount != null ? Amounts.money(maxInvestmentAmount) : null;
        this.investmentPeriodDays = investmentPeriodDays;
        this.active = true;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public UUID getId() {
        return id;
    }

    public String getProductCode() {
        return productCode;
    }

    public String getName() {
        return name;
    }

    public ProductType getProductType() {
        return productType;
    }

    public int getRiskLevel() {
        return riskLevel;
    }

    public BigDecimal getExpectedReturnRate() {
        return expectedReturnRate;
    }

    public BigDecimal getMinInvestmentAmount() {
        return minInvestmentAmount;
    }

    public BigDecimal getMaxInvestmentAmount() {
        return maxInvestmentAmount;
    }

    public Integer getInvestmentPeriodDays() {
        return investmentPeriodDays;
    }

    public String getDescription() {
        return description;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setExpectedReturnRate(BigDecimal expectedReturnRate) {
        this.expectedReturnRate = expectedReturnRate;
        this.updatedAt = Instant.now();
    }

    public void setDescription(String description) {
        this.description = description;
        this.updatedAt = Instant.now();
    }

    public void deactivate() {
        this.active = false;
        this.updatedAt = Instant.now();
    }

    public boolean isFixedTerm() {
        return productType == ProductType.FIXED_TERM && investmentPeriodDays != null;
    }

    /**
     * @throws ValidationException if amount is outside [min, max]; max is optional
     */
    public void checkInvestmentAmount(BigDecimal amount) {
        if (amount.compareTo(minInvestmentAmount) < 0) {
            throw new ValidationException("Investment amount must be at least " + minInvestmentAmount);
        }
        if (maxInvestmentAmount != null && amount.compareTo(maxInvestmentAmount) > 0) {
            throw new ValidationException("Investment amount cannot exceed " + maxInvestmentAmount);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InvestmentProduct that = (InvestmentProduct) o;
        return Objects.equals(productCode, that.productCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productCode);
    }

    @Override
    public String toString() {
        return "InvestmentProduct{" +
                "id=" + id +
                ", productCode='" + productCode + '\'' +
                ", productType=" + productType +
                ", active=" + active +
                '}';
    }
}
