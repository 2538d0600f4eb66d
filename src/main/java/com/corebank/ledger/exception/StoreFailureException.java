package com.corebank.ledger.exception;

/**
 * Persistence was unavailable or the unit of work could not commit.
 * The only retryable kind.
 */
public class StoreFailureException extends CoreBankException {

    public StoreFailureException(String message, Throwable cause) {
        super(ErrorKind.STORE_FAILURE, message, cause);
    }
}
