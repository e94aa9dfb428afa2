package com.flagship.fund_ledger.debt;

/**
 * Which way the money went when the debt was opened.
 */
public enum DebtDirection {
    /** I gave money; the contact owes me. */
    LENDING,
    /** I received money; I owe the contact. */
    BORROWING
}
