package com.corebank.ledger.service;

import com.corebank.ledger.domain.InvestmentProduct.ProductType;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate view of a user's ACTIVE holdings. holdingsCount counts every
 * holding the user ever opened, activeCount only the ACTIVE ones.
 */
public final class PortfolioSummary {

    private final UUID userId;
    private final BigDecimal totalAssets;
    private final BigDecimal totalInvested;
    private final BigDecimal totalGainLoss;
    private final BigDecimal totalReturnRate;
    private final Map<ProductType, BigDecimal> assetAllocation;
    private final int holdingsCount;
    private final int activeCount;

    public PortfolioSummary(UUID userId, BigDecimal totalAssets, BigDecimal totalInvested,
                            BigDecimal totalGainLoss, BigDecimal totalReturnRate,
                            Map<ProductType, BigDecimal> assetAllocation,
                            int holdingsCount, int activeCount) {
        this.userId = userId;
        this.totalAssets = totalAssets;
        this.totalInvested = totalInvested;
        this.totalGainLoss = totalGainLoss;
        this.totalReturnRate = totalReturnRate;
        this.assetAllocation = Collections.unmodifiableMap(assetAllocation);
        this.holdingsCount = holdingsCount;
        this.activeCount = activeCount;
    }

    public UUID getUserId() {
        return userId;
    }

    public BigDecimal getTotalAssets() {
        return totalAssets;
    }

    public BigDecimal getTotalInvested() {
        return totalInvested;
    }

    public BigDecimal getTotalGainLoss() {
        return totalGainLoss;
    }

    public BigDecimal getTotalReturnRate() {
        return totalReturnRate;
    }

    public Map<ProductType, BigDecimal> getAssetAllocation() {
        return assetAllocation;
    }

    public int getHoldingsCount() {
        return holdingsCount;
    }

    public int getActiveCount() {
        return activeCount;
    }
}
