package com.corebank.ledger.domain;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A user's position in one investment product.
 *
 * Lifecycle: created ACTIVE by the first purchase, merged by later purchases
 * (weighted-average cost), reduced by partial redemptions and closed as
 * REDEEMED by a full redemption. REDEEMED is terminal; the next purchase of the
 * same product opens a new holding. MATURED exists for a scheduled maturity
 * process and is not driven by the engine itself.
 *
 * activeKey is "userId:productId" while ACTIVE and null otherwise. Its unique
 * constraint enforces at most one active holding per user and product even
 * when two first purchases race.
 *
 * Valuation fields (current value, unrealized gain/loss, return rate) are not
 * stored; see HoldingValuation.
 */
@Entity
@Table(
    name = "investment_holdings",
    indexes = {
        @Index(name = "idx_holdings_user_id", columnList = "user_id"),
        @Index(name = "idx_holdings_user_product", columnList = "user_id,product_id")
    },
    uniqueConstraints = @UniqueConstraint(name = "uk_holdings_active_key", columnNames = "active_key")
)
public class InvestmentHolding {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Column(nullable = false, precision = 27, scale = 8)
    private BigDecimal shares;

    @Column(name = "average_cost", nullable = false, precision = 27, scale = 8)
    private BigDecimal averageCost;

    @Column(name = "total_invested", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalInvested;

    @Column(name = "realized_gain_loss", nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedGainLoss;

    @Column(name = "purchase_date", nullable = false, updatable = false)
    private Instant purchaseDate;

    @Column(name = "maturity_date", updatable = false)
    private Instant maturityDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private HoldingStatus status;

    @Column(name = "active_key", length = 80)
    private String activeKey;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public enum HoldingStatus {
        ACTIVE,
        MATURED,
        REDEEMED
    }

    protected InvestmentHolding() {
    }

    /**
     * Open a holding from a first purchase.
     *
     * @param shares shares bought (net amount / unit price)
     * @param unitPrice price paid per share, which is the opening average cost
     * @param netAmount amount invested after fees
     * @param investmentPeriodDays fixed-term period, or null for demand products
     */
    public InvestmentHolding(UUID userId, UUID accountId, UUID productId, BigDecimal shares,
                             BigDecimal unitPrice, BigDecimal netAmount, Integer investmentPeriodDays) {
        if (userId == null || accountId == null || productId == null) {
            throw new IllegalArgumentException("User, account and product are required");
        }
        if (!Amounts.isPositive(shares) || !Amounts.isPositive(unitPrice)) {
            throw new IllegalArgumentException("Shares and unit price must be positive");
        }
        this.userId = userId;
        this.accountId = accountId;
        this.productId = productId;
        this.shares = Amounts.shares(shares);
        this.averageCost = unitPrice.setScale(Amounts.COST_SCALE, Amounts.ROUNDING);
        this.totalInvested = Amounts.money(netAmount);
        this.realizedGainLoss = Amounts.ZERO_MONEY;
        this.purchaseDate = Instant.now();
        this.maturityDate = investmentPeriodDays != null
                ? purchaseDate.plus(Duration.ofDays(investmentPeriodDays))
                : null;
        this.status = HoldingStatus.ACTIVE;
        this.activeKey = activeKeyOf(userId, productId);
        this.updatedAt = purchaseDate;
    }

    public static String activeKeyOf(UUID userId, UUID productId) {
        return userId + ":" + productId;
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public UUID getProductId() {
        return productId;
    }

    public BigDecimal getShares() {
        return shares;
    }

    public BigDecimal getAverageCost() {
        return averageCost;
    }

    public BigDecimal getTotalInvested() {
        return totalInvested;
    }

    public BigDecimal getRealizedGainLoss() {
        return realizedGainLoss;
    }

    public Instant getPurchaseDate() {
        return purchaseDate;
    }

    public Instant getMaturityDate() {
        return maturityDate;
    }

    public HoldingStatus getStatus() {
        return status;
    }

    public String getActiveKey() {
        return activeKey;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    public boolean isActive() {
        return status == HoldingStatus.ACTIVE;
    }

    public boolean isOwnedBy(UUID candidateUserId) {
        return userId.equals(candidateUserId);
    }

    /**
     * Fold a further purchase into this holding.
     *
     * average cost = (total invested + net amount) / (shares + new shares).
     * The maturity date of a fixed-term holding is set on creation only.
     */
    public void merge(BigDecimal newShares, BigDecimal netAmount) {
        requireActive();
        if (!Amounts.isPositive(newShares)) {
            throw new IllegalArgumentException("Merged shares must be positive");
        }
        this.shares = Amounts.shares(this.shares.add(newShares));
        this.totalInvested = Amounts.money(this.totalInvested.add(netAmount));
        this.averageCost = this.totalInvested.divide(this.shares, Amounts.COST_SCALE, Amounts.ROUNDING);
        this.updatedAt = Instant.now();
    }

    /**
     * Remove redeemed shares. Redeeming every share closes the holding.
     *
     * A partial redemption leaves averageCost and totalInvested untouched;
     * the invested principal is not reallocated to the redeemed shares.
     *
     * @return true if this redemption closed the holding
     */
    public boolean redeem(BigDecimal redeemedShares) {
        requireActive();
        if (!Amounts.isPositive(redeemedShares) || redeemedShares.compareTo(shares) > 0) {
            throw new IllegalArgumentException(
                String.format("Cannot redeem %s shares from a holding of %s", redeemedShares, shares));
        }
        this.updatedAt = Instant.now();
        if (redeemedShares.compareTo(shares) == 0) {
            this.status = HoldingStatus.REDEEMED;
            this.activeKey = null;
            return true;
        }
        this.shares = Amounts.shares(this.shares.subtract(redeemedShares));
        return false;
    }

    private void requireActive() {
        if (status != HoldingStatus.ACTIVE) {
            throw new IllegalStateException("Holding " + id + " is " + status);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InvestmentHolding that = (InvestmentHolding) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "InvestmentHolding{" +
                "id=" + id +
                ", userId=" + userId +
                ", productId=" + productId +
                ", shares=" + shares +
                ", averageCost=" + averageCost +
                ", totalInvested=" + totalInvested +
                ", status=" + status +
                '}';
    }
}
