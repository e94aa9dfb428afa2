package com.flagship.fund_ledger.ledger.event;

import com.flagship.fund_ledger.ledger.FundingAllocation;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Allocation row as carried inside event payloads.
 */
@Value
public class AllocationPayload {
    UUID fundingSourceId;
    String fundingSourceName;
    BigDecimal amount;

    public static List<AllocationPayload> fromAllocations(List<FundingAllocation> allocations) {
        return allocations.stream()
            .map(a -> new AllocationPayload(a.getFundingSourceId(), a.getFundingSourceName(), a.getAmount().toBigDecimal()))
            .toList();
    }
}
