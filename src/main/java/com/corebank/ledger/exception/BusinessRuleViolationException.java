package com.corebank.ledger.exception;

/**
 * Well-formed request that breaks a business rule, e.g. redeeming an inactive holding.
 */
public class BusinessRuleViolationException extends CoreBankException {

    public BusinessRuleViolationException(String message) {
        super(ErrorKind.BUSINESS_RULE_VIOLATION, message);
    }
}
