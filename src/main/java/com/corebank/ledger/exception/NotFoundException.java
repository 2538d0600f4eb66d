package com.corebank.ledger.exception;

/**
 * Account, holding, product or ledger record does not exist or is not visible to the caller.
 */
public class NotFoundException extends CoreBankException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
