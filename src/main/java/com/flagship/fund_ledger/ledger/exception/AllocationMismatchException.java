package com.flagship.fund_ledger.ledger.exception;

import com.flagship.fund_ledger.money.Money;
import lombok.Getter;

/**
 * Manual allocation total differs from the transaction amount.
 */
@Getter
public class AllocationMismatchException extends LedgerException {

    private final Money allocated;
    private final Money expected;

    public AllocationMismatchException(Money allocated, Money expected) {
        super(String.format("Allocation total %s does not match transaction amount %s", allocated, expected));
        this.allocated = allocated;
        this.expected = expected;
    }

    @Override
    public String getErrorCode() {
        return "ALLOCATION_MISMATCH";
    }
}
