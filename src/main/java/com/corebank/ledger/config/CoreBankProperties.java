package com.corebank.ledger.config;

import com.corebank.ledger.domain.InvestmentProduct.ProductType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables of the ledger and investment engines, bound from the "corebank"
 * prefix. A null limit disables that limit.
 */
@ConfigurationProperties(prefix = "corebank")
public class CoreBankProperties {

    private final Ledger ledger = new Ledger();
    private final Pricing pricing = new Pricing();
    private final Fees fees = new Fees();
    private final Accounts accounts = new Accounts();
    private final Advisory advisory = new Advisory();

    public Ledger getLedger() {
        return ledger;
    }

    public Pricing getPricing() {
        return pricing;
    }

    public Fees getFees() {
        return fees;
    }

    public Accounts getAccounts() {
        return accounts;
    }

    public Advisory getAdvisory() {
        return advisory;
    }

    public static class Ledger {
        /** Largest |debits - credits| still accepted as balanced. */
        private BigDecimal balanceTolerance = new BigDecimal("0.01");
        private BigDecimal minTransactionAmount = new BigDecimal("0.01");
        private BigDecimal maxWithdrawalAmount = new BigDecimal("10000.00");
        private BigDecimal maxTransferAmount = new BigDecimal("50000.00");

        public BigDecimal getBalanceTolerance() { return balanceTolerance; }
        public void setBalanceTolerance(BigDecimal balanceTolerance) { this.balanceTolerance = balanceTolerance; }
        public BigDecimal getMinTransactionAmount() { return minTransactionAmount; }
        public void setMinTransactionAmount(BigDecimal minTransactionAmount) { this.minTransactionAmount = minTransactionAmount; }
        public BigDecimal getMaxWithdrawalAmount() { return maxWithdrawalAmount; }
        public void setMaxWithdrawalAmount(BigDecimal maxWithdrawalAmount) { this.maxWithdrawalAmount = maxWithdrawalAmount; }
        public BigDecimal getMaxTransferAmount() { return maxTransferAmount; }
        public void setMaxTransferAmount(BigDecimal maxTransferAmount) { this.maxTransferAmount = maxTransferAmount; }
    }

    public static class Pricing {
        /** Price of a product that has never been priced; null means NotAvailable. */
        private BigDecimal defaultUnitPrice = new BigDecimal("1.0000");

        public BigDecimal getDefaultUnitPrice() { return defaultUnitPrice; }
        public void setDefaultUnitPrice(BigDecimal defaultUnitPrice) { this.defaultUnitPrice = defaultUnitPrice; }
    }

    public static class Fees {
        private Map<ProductType, BigDecimal> purchaseRates = new EnumMap<>(Map.of(
                ProductType.MONEY_FUND, new BigDecimal("0.0000"),
                ProductType.FIXED_TERM, new BigDecimal("0.0050"),
                ProductType.MUTUAL_FUND, new BigDecimal("0.0150"),
                ProductType.INSURANCE, new BigDecimal("0.0200")));
        private Map<ProductType, BigDecimal> redemptionRates = new EnumMap<>(Map.of(
                ProductType.MONEY_FUND, new BigDecimal("0.0000"),
                ProductType.FIXED_TERM, new BigDecimal("0.0025"),
                ProductType.MUTUAL_FUND, new BigDecimal("0.0075"),
                ProductType.INSURANCE, new BigDecimal("0.0100")));
        private BigDecimal defaultPurchaseRate = new BigDecimal("0.0100");
        private BigDecimal defaultRedemptionRate = new BigDecimal("0.0050");

        public Map<ProductType, BigDecimal> getPurchaseRates() { return purchaseRates; }
        public void setPurchaseRates(Map<ProductType, BigDecimal> purchaseRates) { this.purchaseRates = purchaseRates; }
        public Map<ProductType, BigDecimal> getRedemptionRates() { return redemptionRates; }
        public void setRedemptionRates(Map<ProductType, BigDecimal> redemptionRates) { this.redemptionRates = redemptionRates; }
        public BigDecimal getDefaultPurchaseRate() { return defaultPurchaseRate; }
        public void setDefaultPurchaseRate(BigDecimal defaultPurchaseRate) { this.defaultPurchaseRate = defaultPurchaseRate; }
        public BigDecimal getDefaultRedemptionRate() { return defaultRedemptionRate; }
        public void setDefaultRedemptionRate(BigDecimal defaultRedemptionRate) { this.defaultRedemptionRate = defaultRedemptionRate; }
    }

    public static class Accounts {
        private int maxAccountsPerOwner = 5;

        public int getMaxAccountsPerOwner() { return maxAccountsPerOwner; }
        public void setMaxAccountsPerOwner(int maxAccountsPerOwner) { this.maxAccountsPerOwner = maxAccountsPerOwner; }
    }

    public static class Advisory {
        private int assessmentValidityDays = 365;
        private int maxRecommendations = 5;
        /** Risk level offered to users without a current assessment. */
        private int defaultRiskLevel = 2;

        public int getAssessmentValidityDays() { return assessmentValidityDays; }
        public void setAssessmentValidityDays(int assessmentValidityDays) { this.assessmentValidityDays = assessmentValidityDays; }
        public int getMaxRecommendations() { return maxRecommendations; }
        public void setMaxRecommendations(int maxRecommendations) { this.maxRecommendations = maxRecommendations; }
        public int getDefaultRiskLevel() { return defaultRiskLevel; }
        public void setDefaultRiskLevel(int defaultRiskLevel) { this.defaultRiskLevel = defaultRiskLevel; }
    }
}
