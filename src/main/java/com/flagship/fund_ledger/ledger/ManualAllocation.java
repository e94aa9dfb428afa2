package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * Caller-chosen draw from one funding source.
 */
@Value
public class ManualAllocation {
    UUID fundingSourceId;
    Money amount;
}
