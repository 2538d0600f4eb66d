package com.corebank.ledger.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point scales used throughout the engine.
 *
 * Every intermediate result is quantized with these helpers at the point it is
 * produced, not only when it is serialized, so no sub-unit noise can accumulate.
 */
public final class Amounts {

    /** Currency amounts and balances. */
    public static final int MONEY_SCALE = 4;

    /** Product shares. */
    public static final int SHARE_SCALE = 8;

    /** NAV unit prices. */
    public static final int PRICE_SCALE = 4;

    /** Weighted-average cost per share. */
    public static final int COST_SCALE = 8;

    /** Percentages (return rates, allocations). */
    public static final int RATE_SCALE = 4;

    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    public static final BigDecimal ZERO_MONEY = BigDecimal.ZERO.setScale(MONEY_SCALE);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Amounts() {
    }

    public static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, ROUNDING);
    }

    public static BigDecimal shares(BigDecimal value) {
        return value.setScale(SHARE_SCALE, ROUNDING);
    }

    public static BigDecimal price(BigDecimal value) {
        return value.setScale(PRICE_SCALE, ROUNDING);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /**
     * (part / whole) * 100 at RATE_SCALE; zero when whole is zero.
     */
    public static BigDecimal percentage(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO.setScale(RATE_SCALE);
        }
        return part.multiply(HUNDRED).divide(whole, RATE_SCALE, ROUNDING);
    }
}
