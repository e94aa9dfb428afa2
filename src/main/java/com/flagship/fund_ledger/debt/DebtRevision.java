package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Metadata edit of a debt. Null amount or contact keep the current value;
 * description and due date are replaced as given.
 */
@Value
@Builder
public class DebtRevision {
    Money amount;
    UUID contactId;
    String contactName;
    String description;
    LocalDate dueDate;
}
