package com.corebank.ledger.exception;

/**
 * Failure kinds raised by the ledger and investment engines.
 *
 * Only STORE_FAILURE is transient; every other kind is deterministic for
 * the same input and must not be retried unchanged.
 */
public enum ErrorKind {
    NOT_FOUND,
    VALIDATION_ERROR,
    INSUFFICIENT_FUNDS,
    IMBALANCED_ENTRIES,
    BUSINESS_RULE_VIOLATION,
    STORE_FAILURE;

    public boolean isRetryable() {
        return this == STORE_FAILURE;
    }
}
