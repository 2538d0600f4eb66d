package com.corebank.ledger.service;

/**
 * Both customer-facing legs of a transfer. They share one group id.
 */
public final class TransferResult {

    private final MovementRecord debit;
    private final MovementRecord credit;

    public TransferResult(MovementRecord debit, MovementRecord credit) {
        this.debit = debit;
        this.credit = credit;
    }

    public MovementRecord getDebit() {
        return debit;
    }

    public MovementRecord getCredit() {
        return credit;
    }

    @Override
    public String toString() {
        return "TransferResult{debit=" + debit + ", credit=" + credit + '}';
    }
}
