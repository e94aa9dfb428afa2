package com.flagship.fund_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.debt.DebtDirection;
import com.flagship.fund_ledger.debt.DebtIntent;
import com.flagship.fund_ledger.money.Money;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Opens a debt. Name the contact by {@code contact_id} or by {@code contact_name}.
 */
@Value
@Builder
@Jacksonized
public class CreateDebtRequest {

    @NotNull(message = "Direction is required")
    @JsonProperty("direction")
    DebtDirection direction;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @Digits(integer = 15, fraction = 4, message = "At most 15 integer digits and 4 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("contact_id")
    UUID contactId;

    @Size(max = 100)
    @JsonProperty("contact_name")
    String contactName;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("date")
    LocalDate date;

    public DebtIntent toIntent() {
        return DebtIntent.builder()
            .direction(direction)
            .amount(Money.ofNullable(amount))
            .accountId(accountId)
            .contactId(contactId)
            .contactName(contactName)
            .description(description)
            .dueDate(dueDate)
            .date(date)
            .build();
    }
}
