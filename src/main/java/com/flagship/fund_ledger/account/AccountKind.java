package com.flagship.fund_ledger.account;

/**
 * Kind of money container. Only CREDIT accounts may carry a limit and billing days,
 * and only they may go below zero.
 */
public enum AccountKind {
    BANK,
    EWALLET,
    CASH,
    INVESTMENT,
    CREDIT;

    public boolean isCredit() {
        return this == CREDIT;
    }
}
