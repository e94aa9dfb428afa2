package com.flagship.fund_ledger.ledger.allocation;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * Remaining amount of one funding source inside one account.
 */
@Value
public class TagBalance {
    UUID fundingSourceId;
    String name;
    Money credit;
    Money debit;

    public Money getBalance() {
        return credit.minus(debit);
    }
}
