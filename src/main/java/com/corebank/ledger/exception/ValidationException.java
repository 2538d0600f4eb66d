package com.corebank.ledger.exception;

/**
 * Malformed input: non-positive amounts, amounts outside limits, shares exceeding a holding.
 */
public class ValidationException extends CoreBankException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
