package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * Portion of a transaction attributed to one funding source.
 */
@Value
public class FundingAllocation {
    UUID transactionId;
    UUID fundingSourceId;
    String fundingSourceName;
    Money amount;
}
