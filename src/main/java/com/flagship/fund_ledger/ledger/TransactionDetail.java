package com.flagship.fund_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * A transaction with its allocation rows and line items, as shown in history and
 * used to prefill an edit.
 */
@Value
public class TransactionDetail {
    Transaction transaction;
    List<FundingAllocation> allocations;
    List<LineItem> items;
}
