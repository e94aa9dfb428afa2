package com.flagship.fund_ledger.ledger.allocation;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.util.List;

/**
 * Result of a waterfall run. {@code shortfall} is zero whenever the plan covers the target.
 */
@Value
public class AllocationPlan {
    List<SourceAmount> allocations;
    Money totalAllocated;
    Money shortfall;

    public boolean isComplete() {
        return shortfall.isZero();
    }
}
