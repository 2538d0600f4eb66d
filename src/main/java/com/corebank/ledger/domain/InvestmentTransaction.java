package com.corebank.ledger.domain;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Audit record of one purchase or redemption. Immutable once written.
 *
 * grossAmount is the cash the customer asked to invest (purchase) or the
 * value of the redeemed shares (redemption); netAmount = grossAmount - fee.
 * ledgerGroupId links the record to the balanced cash movement it caused.
 */
@Entity
@Table(
    name = "investment_transactions",
    indexes = {
        @Index(name = "idx_inv_tx_user_created", columnList = "user_id,created_at"),
        @Index(name = "idx_inv_tx_holding_id", columnList = "holding_id")
    }
)
public class InvestmentTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Column(name = "holding_id", updatable = false)
    private UUID holdingId;

    @Column(name = "ledger_group_id", updatable = false)
    private UUID ledgerGroupId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private TransactionKind kind;

    @Column(nullable = false, precision = 27, scale = 8, updatable = false)
    private BigDecimal shares;

    @Column(name = "unit_price", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal unitPrice;

    @Column(name = "gross_amount", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal grossAmount;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal fee;

    @Column(name = "net_amount", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal netAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private TransactionStatus status;

    @Column(name = "settlement_date", updatable = false)
    private Instant settlementDate;

    @Column(length = 500, updatable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum TransactionKind {
        PURCHASE,
        REDEMPTION,
        DIVIDEND,
        INTEREST
    }

    public enum TransactionStatus {
        PENDING,
        CONFIRMED,
        FAILED,
        CANCELLED
    }

    protected InvestmentTransaction() {
    }

    private InvestmentTransaction(Builder b) {
        this.userId = Objects.requireNonNull(b.userId, "userId");
        this.accountId = Objects.requireNonNull(b.accountId, "accountId");
        this.productId = Objects.requireNonNull(b.productId, "productId");
        this.kind = Objects.requireNonNull(b.kind, "kind");
        this.holdingId = b.holdingId;
        this.ledgerGroupId = b.ledgerGroupId;
        this.shares = Amounts.shares(b.shares);
        this.unitPrice = Amounts.price(b.unitPrice);
        this.grossAmount = Amounts.money(b.grossAmount);
        this.fee = Amounts.money(b.fee);
        this.netAmount = Amounts.money(b.netAmount);
        if (fee.signum() < 0) {
            throw new IllegalArgumentException("Fee cannot be negative");
        }
        this.status = b.status != null ? b.status : TransactionStatus.CONFIRMED;
        this.description = b.description;
        this.createdAt = Instant.now();
        this.settlementDate = this.status == TransactionStatus.CONFIRMED ? this.createdAt : null;
    }

    public static Builder builder() {
        return new Builder();
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

    public UUID getHoldingId() {
        return holdingId;
    }

    public UUID getLedgerGroupId() {
        return ledgerGroupId;
    }

    public TransactionKind getKind() {
        return kind;
    }

    public BigDecimal getShares() {
        return shares;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public BigDecimal getGrossAmount() {
        return grossAmount;
    }

    public BigDecimal getFee() {
        return fee;
    }

    public BigDecimal getNetAmount() {
        return netAmount;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    public Instant getSettlementDate() {
        return settlementDate;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InvestmentTransaction that = (InvestmentTransaction) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "InvestmentTransaction{" +
                "id=" + id +
                ", kind=" + kind +
                ", productId=" + productId +
                ", shares=" + shares +
                ", unitPrice=" + unitPrice +
                ", grossAmount=" + grossAmount +
                ", fee=" + fee +
                ", netAmount=" + netAmount +
                ", status=" + status +
                '}';
    }

    public static final class Builder {
        private UUID userId;
        private UUID accountId;
        private UUID productId;
        private UUID holdingId;
        private UUID ledgerGroupId;
        private TransactionKind kind;
        private BigDecimal shares;
        private BigDecimal unitPrice;
        private BigDecimal grossAmount;
        private BigDecimal fee;
        private BigDecimal netAmount;
        private TransactionStatus status;
        private String description;

        private Builder() {
        }

        public Builder userId(UUID userId) { this.userId = userId; return this; }
        public Builder accountId(UUID accountId) { this.accountId = accountId; return this; }
        public Builder productId(UUID productId) { this.productId = productId; return this; }
        public Builder holdingId(UUID holdingId) { this.holdingId = holdingId; return this; }
        public Builder ledgerGroupId(UUID ledgerGroupId) { this.ledgerGroupId = ledgerGroupId; return this; }
        public Builder kind(TransactionKind kind) { this.kind = kind; return this; }
        public Builder shares(BigDecimal shares) { this.shares = shares; return this; }
        public Builder unitPrice(BigDecimal unitPrice) { this.unitPrice = unitPrice; return this; }
        public Builder grossAmount(BigDecimal grossAmount) { this.grossAmount = grossAmount; return this; }
        public Builder fee(BigDecimal fee) { this.fee = fee; return this; }
        public Builder netAmount(BigDecimal netAmount) { this.netAmount = netAmount; return this; }
        public Builder status(TransactionStatus status) { this.status = status; return this; }
        public Builder description(String description) { this.description = description; return this; }

        public InvestmentTransaction build() {
            return new InvestmentTransaction(this);
        }
    }
}
