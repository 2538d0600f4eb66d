package com.corebank.ledger.service;

import com.corebank.ledger.config.CoreBankProperties;
import com.corebank.ledger.domain.InvestmentProduct.ProductType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

class FeeScheduleTest {

    private final CoreBankProperties properties = new CoreBankProperties();
    private final FeeSchedule fees = new FeeSchedule(properties);

    @ParameterizedTest(name = "{0}: purchase fee on 1000.00 = {1}, redemption fee = {2}")
    @CsvSource({
        "MONEY_FUND,  0.0000,  0.0000",
        "FIXED_TERM,  5.0000,  2.5000",
        "MUTUAL_FUND, 15.0000, 7.5000",
        "INSURANCE,   20.0000, 10.0000"
    })
    void defaultRateTable(ProductType type, String purchaseFee, String redemptionFee) {
        BigDecimal amount = new BigDecimal("1000.00");

        assertThat(fees.purchaseFee(type, amount)).isEqualTo(new BigDecimal(purchaseFee));
        assertThat(fees.redemptionFee(type, amount)).isEqualTo(new BigDecimal(redemptionFee));
    }

    @Test @DisplayName("type missing from the table pays the default rate")
    void defaultRate() {
        properties.getFees().getPurchaseRates().remove(ProductType.INSURANCE);
        properties.getFees().getRedemptionRates().remove(ProductType.INSURANCE);

        assertThat(fees.purchaseRate(ProductType.INSURANCE)).isEqualByComparingTo("0.0100");
        assertThat(fees.redemptionRate(ProductType.INSURANCE)).isEqualByComparingTo("0.0050");
    }

    @Test @DisplayName("fees round half-even to money scale")
    void rounding() {
        // 0.333333 * 0.0150 = 0.0049999950
        assertThat(fees.purchaseFee(ProductType.MUTUAL_FUND, new BigDecimal("0.333333")))
            .isEqualTo(new BigDecimal("0.0050"));
    }
}
