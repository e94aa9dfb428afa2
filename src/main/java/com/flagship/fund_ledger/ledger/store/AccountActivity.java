package com.flagship.fund_ledger.ledger.store;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

/**
 * Totals shown on an account's detail view.
 */
@Value
public class AccountActivity {
    Money totalIncome;
    Money totalExpense;
    long transactionCount;
}
