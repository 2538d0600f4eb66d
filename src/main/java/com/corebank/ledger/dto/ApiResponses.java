package com.corebank.ledger.dto;

import com.corebank.ledger.domain.Account;
import com.corebank.ledger.domain.InvestmentHolding;
import com.corebank.ledger.domain.InvestmentProduct;
import com.corebank.ledger.domain.InvestmentTransaction;
import com.corebank.ledger.domain.ProductNav;
import com.corebank.ledger.domain.RiskAssessment;
import com.corebank.ledger.domain.TransactionEntry;
import com.corebank.ledger.domain.TransactionGroup;
import com.corebank.ledger.service.AccountSummary;
import com.corebank.ledger.service.BalancedTransaction;
import com.corebank.ledger.service.HoldingValuation;
import com.corebank.ledger.service.MovementRecord;
import com.corebank.ledger.service.PortfolioSummary;
import com.corebank.ledger.service.ProductRecommendation;
import com.corebank.ledger.service.TransferResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Response DTOs for API endpoints. Domain objects never leave the controllers.
 */
public class ApiResponses {

    // ─────────────────────────────────────────────────────────────────────────
    // ACCOUNTS & LEDGER
    // ─────────────────────────────────────────────────────────────────────────

    public static class AccountResponse {
        private UUID accountId;
        private String accountNumber;
        private UUID ownerId;
        private String accountType;
        private BigDecimal balance;
        private Instant createdAt;
        private Instant updatedAt;

        public AccountResponse(Account account) {
            this.accountId = account.getId();
            this.accountNumber = account.getAccountNumber();
            this.ownerId = account.getOwnerId();
            this.accountType = account.getAccountType().toString();
            this.balance = account.getBalance();
            this.createdAt = account.getCreatedAt();
            this.updatedAt = account.getUpdatedAt();
        }

        // Getters
        public UUID getAccountId() { return accountId; }
        public String getAccountNumber() { return accountNumber; }
        public UUID getOwnerId() { return ownerId; }
        public String getAccountType() { return accountType; }
        public BigDecimal getBalance() { return balance; }
        public Instant getCreatedAt() { return createdAt; }
        public Instant getUpdatedAt() { return updatedAt; }
    }

    public static class AccountListResponse {
        private UUID ownerId;
        private long accountCount;
        private BigDecimal totalBalance;
        private List<AccountResponse> accounts;

        public AccountListResponse(AccountSummary summary, List<Account> accounts) {
            this.ownerId = summary.getOwnerId();
            this.accountCount = summary.getAccountCount();
            this.totalBalance = summary.getTotalBalance();
            this.accounts = accounts.stream().map(AccountResponse::new).collect(Collectors.toList());
        }

        public UUID getOwnerId() { return ownerId; }
        public long getAccountCount() { return accountCount; }
        public BigDecimal getTotalBalance() { return totalBalance; }
        public List<AccountResponse> getAccounts() { return accounts; }
    }

    /**
     * One customer-facing movement (the real leg of a deposit, withdrawal or transfer).
     */
    public static class MovementResponse {
        private UUID groupId;
        private UUID entryId;
        private UUID accountId;
        private String kind;
        private String entryType;
        private BigDecimal amount;
        private BigDecimal balanceAfter;
        private String description;
        private String status;
        private Instant timestamp;

        public MovementResponse(MovementRecord record) {
            this.groupId = record.getGroupId();
            this.entryId = record.getEntryId();
            this.accountId = record.getAccountId();
            this.kind = record.getKind().toString();
            this.entryType = record.getEntryType().toString();
            this.amount = record.getAmount();
            this.balanceAfter = record.getBalanceAfter();
            this.description = record.getDescription();
            this.status = record.getStatus().toString();
            this.timestamp = record.getTimestamp();
        }

        // Getters
        public UUID getGroupId() { return groupId; }
        public UUID getEntryId() { return entryId; }
        public UUID getAccountId() { return accountId; }
        public String getKind() { return kind; }
        public String getEntryType() { return entryType; }
        public BigDecimal getAmount() { return amount; }
        public BigDecimal getBalanceAfter() { return balanceAfter; }
        public String getDescription() { return description; }
        public String getStatus() { return status; }
        public Instant getTimestamp() { return timestamp; }
    }

    public static class TransferResponse {
        private UUID groupId;
        private BigDecimal amount;
        private MovementResponse debit;
        private MovementResponse credit;

        public TransferResponse(TransferResult result) {
            this.groupId = result.getDebit().getGroupId();
            this.amount = result.getDebit().getAmount();
            this.debit = new MovementResponse(result.getDebit());
            this.credit = new MovementResponse(result.getCredit());
        }

        // Getters
        public UUID getGroupId() { return groupId; }
        public BigDecimal getAmount() { return amount; }
        public MovementResponse getDebit() { return debit; }
        public MovementResponse getCredit() { return credit; }
    }

    public static class EntryResponse {
        private UUID entryId;
        private UUID groupId;
        private UUID accountId;
        private String entryType;
        private BigDecimal amount;
        private BigDecimal balanceAfter;
        private boolean virtualLeg;
        private String description;
        private Instant createdAt;

        public EntryResponse(TransactionEntry entry) {
            this.entryId = entry.getId();
            this.groupId = entry.getGroup().getId();
            this.accountId = entry.getAccountId();
            this.entryType = entry.getEntryType().toString();
            this.amount = entry.getAmount();
            this.balanceAfter = entry.getBalanceAfter();
            this.virtualLeg = entry.isVirtualLeg();
            this.description = entry.getDescription();
            this.createdAt = entry.getCreatedAt();
        }

        // Getters
        public UUID getEntryId() { return entryId; }
        public UUID getGroupId() { return groupId; }
        public UUID getAccountId() { return accountId; }
        public String getEntryType() { return entryType; }
        public BigDecimal getAmount() { return amount; }
        public BigDecimal getBalanceAfter() { return balanceAfter; }
        public boolean isVirtualLeg() { return virtualLeg; }
        public String getDescription() { return description; }
        public Instant getCreatedAt() { return createdAt; }
    }

    public static class GroupResponse {
        private UUID groupId;
        private String kind;
        private String status;
        private String description;
        private BigDecimal totalAmount;
        private Instant createdAt;
        private List<EntryResponse> entries;

        public GroupResponse(BalancedTransaction transaction) {
            TransactionGroup group = transaction.getGroup();
            this.groupId = group.getId();
            this.kind = group.getKind().toString();
            this.status = group.getStatus().toString();
            this.description = group.getDescription();
            this.totalAmount = group.getTotalAmount();
            this.createdAt = group.getCreatedAt();
            this.entries = transaction.getEntries().stream().map(EntryResponse::new).collect(Collectors.toList());
        }

        // Getters
        public UUID getGroupId() { return groupId; }
        public String getKind() { return kind; }
        public String getStatus() { return status; }
        public String getDescription() { return description; }
        public BigDecimal getTotalAmount() { return totalAmount; }
        public Instant getCreatedAt() { return createdAt; }
        public List<EntryResponse> getEntries() { return entries; }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // INVESTMENTS
    // ─────────────────────────────────────────────────────────────────────────

    public static class ProductResponse {
        private UUID productId;
        private String productCode;
        private String name;
        private String productType;
        private int riskLevel;
        private BigDecimal expectedReturnRate;
        private BigDecimal minInvestmentAmount;
        private BigDecimal maxInvestmentAmount;
        private Integer investmentPeriodDays;
        private String description;
        private boolean active;

        public ProductResponse(InvestmentProduct product) {
            this.productId = product.getId();
            this.productCode = product.getProductCode();
            this.name = product.getName();
            this.productType = product.getProductType().toString();
            this.riskLevel = product.getRiskLevel();
            this.expectedReturnRate = product.getExpectedReturnRate();
            this.minInvestmentAmount = product.getMinInvestmentAmount();
            this.maxInvestmentAmount = product.getMaxInvestmentAmount();
            this.investmentPeriodDays = product.getInvestmentPeriodDays();
            this.description = product.getDescription();
            this.active = product.isActive();
        }

        // Getters
        public UUID getProductId() { return productId; }
        public String getProductCode() { return productCode; }
        public String getName() { return name; }
        public String getProductType() { return productType; }
        public int getRiskLevel() { return riskLevel; }
        public BigDecimal getExpectedReturnRate() { return expectedReturnRate; }
        public BigDecimal getMinInvestmentAmount() { return minInvestmentAmount; }
        public BigDecimal getMaxInvestmentAmount() { return maxInvestmentAmount; }
        public Integer getInvestmentPeriodDays() { return investmentPeriodDays; }
        public String getDescription() { return description; }
        public boolean isActive() { return active; }
    }

    public static class NavResponse {
        private UUID productId;
        private LocalDate navDate;
        private BigDecimal unitPrice;

        public NavResponse(ProductNav nav) {
            this.productId = nav.getProductId();
            this.navDate = nav.getNavDate();
            this.unitPrice = nav.getUnitPrice();
        }

        public UUID getProductId() { return productId; }
        public LocalDate getNavDate() { return navDate; }
        public BigDecimal getUnitPrice() { return unitPrice; }
    }

    public static class RiskAssessmentResponse {
        private UUID assessmentId;
        private UUID userId;
        private int riskTolerance;
        private String investmentExperience;
        private String investmentGoal;
        private String investmentHorizon;
        private String monthlyIncomeRange;
        private int assessmentScore;
        private Instant expiresAt;
        private Instant createdAt;

        public RiskAssessmentResponse(RiskAssessment assessment) {
            this.assessmentId = assessment.getId();
            this.userId = assessment.getUserId();
            this.riskTolerance = assessment.getRiskTolerance();
            this.investmentExperience = assessment.getExperience().toString();
            this.investmentGoal = assessment.getGoal().toString();
            this.investmentHorizon = assessment.getHorizon().toString();
            this.monthlyIncomeRange = assessment.getMonthlyIncomeRange();
            this.assessmentScore = assessment.getScore();
            this.expiresAt = assessment.getExpiresAt();
            this.createdAt = assessment.getCreatedAt();
        }

        public UUID getAssessmentId() { return assessmentId; }
        public UUID getUserId() { return userId; }
        public int getRiskTolerance() { return riskTolerance; }
        public String getInvestmentExperience() { return investmentExperience; }
        public String getInvestmentGoal() { return investmentGoal; }
        public String getInvestmentHorizon() { return investmentHorizon; }
        public String getMonthlyIncomeRange() { return monthlyIncomeRange; }
        public int getAssessmentScore() { return assessmentScore; }
        public Instant getExpiresAt() { return expiresAt; }
        public Instant getCreatedAt() { return createdAt; }
    }

    public static class RecommendationResponse {
        private ProductResponse product;
        private BigDecimal recommendationScore;
        private String recommendationReason;
        private boolean riskMatch;
        private BigDecimal suggestedAllocation;

        public RecommendationResponse(ProductRecommendation recommendation) {
            this.product = new ProductResponse(recommendation.getProduct());
            this.recommendationScore = recommendation.getScore();
            this.recommendationReason = recommendation.getReason();
            this.riskMatch = recommendation.isRiskMatch();
            this.suggestedAllocation = recommendation.getSuggestedAllocation();
        }

        public ProductResponse getProduct() { return product; }
        public BigDecimal getRecommendationScore() { return recommendationScore; }
        public String getRecommendationReason() { return recommendationReason; }
        public boolean isRiskMatch() { return riskMatch; }
        public BigDecimal getSuggestedAllocation() { return suggestedAllocation; }
    }

    public static class HoldingResponse {
        private UUID holdingId;
        private UUID accountId;
        private UUID productId;
        private BigDecimal shares;
        private BigDecimal averageCost;
        private BigDecimal totalInvested;
        private BigDecimal unitPrice;
        private BigDecimal currentValue;
        private BigDecimal unrealizedGainLoss;
        private BigDecimal realizedGainLoss;
        private BigDecimal returnRate;
        private String status;
        private Instant purchaseDate;
        private Instant maturityDate;

        public HoldingResponse(HoldingValuation valuation) {
            InvestmentHolding holding = valuation.getHolding();
            this.holdingId = holding.getId();
            this.accountId = holding.getAccountId();
            this.productId = holding.getProductId();
            this.shares = holding.getShares();
            this.averageCost = holding.getAverageCost();
            this.totalInvested = holding.getTotalInvested();
            this.unitPrice = valuation.getUnitPrice();
            this.currentValue = valuation.getCurrentValue();
            this.unrealizedGainLoss = valuation.getUnrealizedGainLoss();
            this.realizedGainLoss = holding.getRealizedGainLoss();
            this.returnRate = valuation.getReturnRate();
            this.status = holding.getStatus().toString();
            this.purchaseDate = holding.getPurchaseDate();
            this.maturityDate = holding.getMaturityDate();
        }

        // Getters
        public UUID getHoldingId() { return holdingId; }
        public UUID getAccountId() { return accountId; }
        public UUID getProductId() { return productId; }
        public BigDecimal getShares() { return shares; }
        public BigDecimal getAverageCost() { return averageCost; }
        public BigDecimal getTotalInvested() { return totalInvested; }
        public BigDecimal getUnitPrice() { return unitPrice; }
        public BigDecimal getCurrentValue() { return currentValue; }
        public BigDecimal getUnrealizedGainLoss() { return unrealizedGainLoss; }
        public BigDecimal getRealizedGainLoss() { return realizedGainLoss; }
        public BigDecimal getReturnRate() { return returnRate; }
        public String getStatus() { return status; }
        public Instant getPurchaseDate() { return purchaseDate; }
        public Instant getMaturityDate() { return maturityDate; }
    }

    public static class PortfolioResponse {
        private UUID userId;
        private BigDecimal totalAssets;
        private BigDecimal totalInvested;
        private BigDecimal totalGainLoss;
        private BigDecimal totalReturnRate;
        private Map<String, BigDecimal> assetAllocation;
        private int holdingsCount;
        private int activeProductsCount;

        public PortfolioResponse(PortfolioSummary summary) {
            this.userId = summary.getUserId();
            this.totalAssets = summary.getTotalAssets();
            this.totalInvested = summary.getTotalInvested();
            this.totalGainLoss = summary.getTotalGainLoss();
            this.totalReturnRate = summary.getTotalReturnRate();
            this.assetAllocation = summary.getAssetAllocation().entrySet().stream()
                    .collect(Collectors.toMap(e -> e.getKey().toString(), Map.Entry::getValue));
            this.holdingsCount = summary.getHoldingsCount();
            this.activeProductsCount = summary.getActiveCount();
        }

        // Getters
        public UUID getUserId() { return userId; }
        public BigDecimal getTotalAssets() { return totalAssets; }
        public BigDecimal getTotalInvested() { return totalInvested; }
        public BigDecimal getTotalGainLoss() { return totalGainLoss; }
        public BigDecimal getTotalReturnRate() { return totalReturnRate; }
        public Map<String, BigDecimal> getAssetAllocation() { return assetAllocation; }
        public int getHoldingsCount() { return holdingsCount; }
        public int getActiveProductsCount() { return activeProductsCount; }
    }

    public static class InvestmentTransactionResponse {
        private UUID transactionId;
        private UUID userId;
        private UUID accountId;
        private UUID productId;
        private UUID holdingId;
        private UUID ledgerGroupId;
        private String kind;
        private BigDecimal shares;
        private BigDecimal unitPrice;
        private BigDecimal grossAmount;
        private BigDecimal fee;
        private BigDecimal netAmount;
        private String status;
        private Instant settlementDate;
        private Instant createdAt;

        public InvestmentTransactionResponse(InvestmentTransaction tx) {
            this.transactionId = tx.getId();
            this.userId = tx.getUserId();
            this.accountId = tx.getAccountId();
            this.productId = tx.getProductId();
            this.holdingId = tx.getHoldingId();
            this.ledgerGroupId = tx.getLedgerGroupId();
            this.kind = tx.getKind().toString();
            this.shares = tx.getShares();
            this.unitPrice = tx.getUnitPrice();
            this.grossAmount = tx.getGrossAmount();
            this.fee = tx.getFee();
            this.netAmount = tx.getNetAmount();
            this.status = tx.getStatus().toString();
            this.settlementDate = tx.getSettlementDate();
            this.createdAt = tx.getCreatedAt();
        }

        // Getters
        public UUID getTransactionId() { return transactionId; }
        public UUID getUserId() { return userId; }
        public UUID getAccountId() { return accountId; }
        public UUID getProductId() { return productId; }
        public UUID getHoldingId() { return holdingId; }
        public UUID getLedgerGroupId() { return ledgerGroupId; }
        public String getKind() { return kind; }
        public BigDecimal getShares() { return shares; }
        public BigDecimal getUnitPrice() { return unitPrice; }
        public BigDecimal getGrossAmount() { return grossAmount; }
        public BigDecimal getFee() { return fee; }
        public BigDecimal getNetAmount() { return netAmount; }
        public String getStatus() { return status; }
        public Instant getSettlementDate() { return settlementDate; }
        public Instant getCreatedAt() { return createdAt; }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // ERRORS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Error response. retryable is true only for store failures.
     */
    public static class ErrorResponse {
        private String error;
        private String message;
        private boolean retryable;
        private Instant timestamp;

        public ErrorResponse(String error, String message) {
            this(error, message, false);
        }

        public ErrorResponse(String error, String message, boolean retryable) {
            this.error = error;
            this.message = message;
            this.retryable = retryable;
            this.timestamp = Instant.now();
        }

        // Getters
        public String getError() { return error; }
        public String getMessage() { return message; }
        public boolean isRetryable() { return retryable; }
        public Instant getTimestamp() { return timestamp; }
    }
}
