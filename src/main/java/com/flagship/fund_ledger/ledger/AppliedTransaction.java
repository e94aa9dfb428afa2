package com.flagship.fund_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * A transaction row as written, with the allocation rows written alongside it.
 */
@Value
public class AppliedTransaction {
    Transaction transaction;
    List<FundingAllocation> allocations;
}
