package com.corebank.ledger.dto;

import com.corebank.ledger.domain.Account;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * DTO for opening an account.
 */
public class OpenAccountRequest {

    @NotNull(message = "Owner ID is required")
    private UUID ownerId;

    @NotNull(message = "Account type is required")
    private Account.AccountType accountType;

    @DecimalMin(value = "0.00", message = "Initial deposit cannot be negative")
    private BigDecimal initialDeposit;

    public OpenAccountRequest() {
    }

    public OpenAccountRequest(UUID ownerId, Account.AccountType accountType, BigDecimal initialDeposit) {
        this.ownerId = ownerId;
        this.accountType = accountType;
        this.initialDeposit = initialDeposit;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(UUID ownerId) {
        this.ownerId = ownerId;
    }

    public Account.AccountType getAccountType() {
        return accountType;
    }

    public void setAccountType(Account.AccountType accountType) {
        this.accountType = accountType;
    }

    public BigDecimal getInitialDeposit() {
        return initialDeposit;
    }

    public void setInitialDeposit(BigDecimal initialDeposit) {
        this.initialDeposit = initialDeposit;
    }
}
