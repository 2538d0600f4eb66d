package com.corebank.ledger.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * DTO for recording a product NAV. navDate defaults to today.
 */
public class NavRequest {

    private LocalDate navDate;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.0001", message = "Unit price must be positive")
    private BigDecimal unitPrice;

    public NavRequest() {
    }

    public NavRequest(LocalDate navDate, BigDecimal unitPrice) {
        this.navDate = navDate;
        this.unitPrice = unitPrice;
    }

    public LocalDate getNavDate() {
        return navDate;
    }

    public void setNavDate(LocalDate navDate) {
        this.navDate = navDate;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public void setUnitPrice(BigDecimal unitPrice) {
        this.unitPrice = unitPrice;
    }
}
