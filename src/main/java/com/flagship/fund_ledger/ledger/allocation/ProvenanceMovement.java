package com.flagship.fund_ledger.ledger.allocation;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * One allocation row seen from a given account: money of a funding source that
 * entered the account (CREDIT) or left it (DEBIT).
 */
@Value
public class ProvenanceMovement {
    UUID fundingSourceId;
    String fundingSourceName;
    Direction direction;
    Money amount;

    public enum Direction {
        CREDIT,
        DEBIT
    }
}
