package com.corebank.ledger.service;

import com.corebank.ledger.config.CoreBankProperties;
import com.corebank.ledger.domain.Amounts;
import com.corebank.ledger.domain.InvestmentProduct.ProductType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Product-type keyed purchase and redemption fee rates.
 *
 * A type missing from the configured table pays the default rate. Fees are
 * rounded to money scale; the house keeps the fee, it never becomes a ledger
 * leg of its own.
 */
@Component
public class FeeSchedule {

    private final CoreBankProperties.Fees fees;

    public FeeSchedule(CoreBankProperties properties) {
        this.fees = properties.getFees();
    }

    public BigDecimal purchaseRate(ProductType productType) {
        return fees.getPurchaseRates().getOrDefault(productType, fees.getDefaultPurchaseRate());
    }

    public BigDecimal redemptionRate(ProductType productType) {
        return fees.getRedemptionRates().getOrDefault(productType, fees.getDefaultRedemptionRate());
    }

    public BigDecimal purchaseFee(ProductType productType, BigDecimal amount) {
        return Amounts.money(amount.multiply(purchaseRate(productType)));
    }

    public BigDecimal redemptionFee(ProductType productType, BigDecimal grossAmount) {
        return Amounts.money(grossAmount.multiply(redemptionRate(productType)));
    }
}
