package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

/**
 * Totals over active (unpaid) debts.
 */
@Value
public class DebtSummary {
    Money totalLent;
    Money totalBorrowed;
    long activeLendingCount;
    long activeBorrowingCount;
}
