package com.corebank.ledger.service;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read-only price oracle for the investment engine.
 *
 * Callers resolve the price before taking any row lock so a slow lookup
 * never holds an account or holding row.
 */
public interface PricingService {

    /**
     * @return the current unit price, scale 4, always positive
     * @throws com.corebank.ledger.exception.NotFoundException if no price is available
     */
    BigDecimal getCurrentUnitPrice(UUID productId);
}
