package com.corebank.ledger.exception;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A debit would drive a persisted balance below zero.
 */
public class InsufficientFundsException extends CoreBankException {

    public InsufficientFundsException(String message) {
        super(ErrorKind.INSUFFICIENT_FUNDS, message);
    }

    public InsufficientFundsException(UUID accountId, BigDecimal balance, BigDecimal requested) {
        this(String.format("Insufficient funds in account %s: balance=%s, requested=%s",
                accountId, balance, requested));
    }
}
