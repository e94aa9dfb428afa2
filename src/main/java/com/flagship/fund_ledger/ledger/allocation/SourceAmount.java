package com.flagship.fund_ledger.ledger.allocation;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * Planned draw of {@code amount} from one funding source.
 */
@Value
public class SourceAmount {
    UUID fundingSourceId;
    String fundingSourceName;
    Money amount;
}
