package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Itemized detail of an EXPENSE. Does not take part in provenance.
 */
@Value
public class LineItem {
    String name;
    Money unitPrice;
    int quantity;
    String categoryName;

    public Money total() {
        return Money.of(unitPrice.toBigDecimal().multiply(BigDecimal.valueOf(quantity)));
    }
}
