package com.corebank.ledger.service;

import com.corebank.ledger.domain.Amounts;
import com.corebank.ledger.domain.InvestmentHolding;

import java.math.BigDecimal;

/**
 * A holding priced at a given unit price.
 *
 *   current value        = shares * unit price
 *   unrealized gain/loss = current value - total invested
 *   return rate          = unrealized / total invested * 100, or 0 with nothing invested
 *
 * All three are money scale and recomputed on every read; none is persisted.
 */
public final class HoldingValuation {

    private final InvestmentHolding holding;
    private final BigDecimal unitPrice;
    private final BigDecimal currentValue;
    private final BigDecimal unrealizedGainLoss;
    private final BigDecimal returnRate;

    private HoldingValuation(InvestmentHolding holding, BigDecimal unitPrice) {
        this.holding = holding;
        this.unitPrice = unitPrice;
        this.currentValue = Amounts.money(holding.getShares().multiply(unitPrice));
        this.unrealizedGainLoss = Amounts.money(currentValue.subtract(holding.getTotalInvested()));
        this.returnRate = Amounts.percentage(unrealizedGainLoss, holding.getTotalInvested());
    }

    public static HoldingValuation of(InvestmentHolding holding, BigDecimal unitPrice) {
        return new HoldingValuation(holding, unitPrice);
    }

    public InvestmentHolding getHolding() {
        return holding;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public BigDecimal getCurrentValue() {
        return currentValue;
    }

    public BigDecimal getUnrealizedGainLoss() {
        return unrealizedGainLoss;
    }

    public BigDecimal getReturnRate() {
        return returnRate;
    }
}
