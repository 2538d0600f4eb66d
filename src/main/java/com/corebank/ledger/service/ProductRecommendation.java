package com.corebank.ledger.service;

import com.corebank.ledger.domain.InvestmentProduct;

import java.math.BigDecimal;

/**
 * An active product suggested to a user. score is in (0, 1] at rate scale;
 * suggestedAllocation is a percentage of the user's investable funds.
 */
public final class ProductRecommendation {

    private final InvestmentProduct product;
    private final BigDecimal score;
    private final String reason;
    private final boolean riskMatch;
    private final BigDecimal suggestedAllocation;

    public ProductRecommendation(InvestmentProduct product, BigDecimal score, String reason,
                                 boolean riskMatch, BigDecimal suggestedAllocation) {
        this.product = product;
        this.score = score;
        this.reason = reason;
        this.riskMatch = riskMatch;
        this.suggestedAllocation = suggestedAllocation;
    }

    public InvestmentProduct getProduct() {
        return product;
    }

    public BigDecimal getScore() {
        return score;
    }

    public String getReason() {
        return reason;
    }

    public boolean isRiskMatch() {
        return riskMatch;
    }

    public BigDecimal getSuggestedAllocation() {
        return suggestedAllocation;
    }
}
