package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.ledger.Transaction;
import lombok.Value;

/**
 * Debt state after a payment, with the REPAYMENT transaction that moved the money
 * (null for an administrative settlement).
 */
@Value
public class DebtPayment {
    Debt debt;
    Transaction transaction;
}
