package com.corebank.ledger.exception;

import java.math.BigDecimal;

/**
 * Debit and credit totals of a balanced-transaction request differ by more
 * than the configured tolerance. Never expected from well-formed callers.
 */
public class ImbalancedEntriesException extends CoreBankException {

    private final BigDecimal debitTotal;
    private final BigDecimal creditTotal;

    public ImbalancedEntriesException(BigDecimal debitTotal, BigDecimal creditTotal) {
        super(ErrorKind.IMBALANCED_ENTRIES,
              String.format("Transaction is not balanced: debits=%s, credits=%s", debitTotal, creditTotal));
        this.debitTotal = debitTotal;
        this.creditTotal = creditTotal;
    }

    public BigDecimal getDebitTotal() {
        return debitTotal;
    }

    public BigDecimal getCreditTotal() {
        return creditTotal;
    }
}
