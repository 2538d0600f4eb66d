package com.corebank.ledger.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * DTO for buying into an investment product.
 */
public class PurchaseRequest {

    @NotNull(message = "Account ID is required")
    private UUID accountId;

    @NotNull(message = "Product ID is required")
    private UUID productId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be at least 0.01")
    private BigDecimal amount;

    public PurchaseRequest() {
    }

    public PurchaseRequest(UUID accountId, UUID productId, BigDecimal amount) {
        this.accountId = accountId;
        this.productId = productId;
        this.amount = amount;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public void setAccountId(UUID accountId) {
        this.accountId = accountId;
    }

    public UUID getProductId() {
        return productId;
    }

    public void setProductId(UUID productId) {
        this.productId = productId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }
}
