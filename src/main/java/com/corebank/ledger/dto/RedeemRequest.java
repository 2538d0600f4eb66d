package com.corebank.ledger.dto;

import jakarta.validation.constraints.DecimalMin;

import java.math.BigDecimal;

/**
 * DTO for redeeming shares. An empty body or a null share count redeems the
 * whole holding.
 */
public class RedeemRequest {

    @DecimalMin(value = "0.00000001", message = "Shares must be positive")
    private BigDecimal shares;

    public RedeemRequest() {
    }

    public RedeemRequest(BigDecimal shares) {
        this.shares = shares;
    }

    public BigDecimal getShares() {
        return shares;
    }

    public void setShares(BigDecimal shares) {
        this.shares = shares;
    }
}
