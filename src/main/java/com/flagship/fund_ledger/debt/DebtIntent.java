package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for opening a debt. The contact is named either by id or by name; a new
 * name creates the contact.
 */
@Value
@Builder
public class DebtIntent {
    DebtDirection direction;
    Money amount;
    UUID accountId;
    UUID contactId;
    String contactName;
    String description;
    LocalDate dueDate;
    LocalDate date;
}
