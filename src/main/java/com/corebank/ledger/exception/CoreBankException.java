package com.corebank.ledger.exception;

/**
 * Base class of every failure the core raises.
 *
 * Any CoreBankException thrown inside a service call rolls back the enclosing
 * unit of work, so callers never observe a partial movement.
 */
public abstract class CoreBankException extends RuntimeException {

    private final ErrorKind kind;

    protected CoreBankException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CoreBankException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
