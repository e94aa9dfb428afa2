package com.flagship.fund_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.debt.DebtRevision;
import com.flagship.fund_ledger.money.Money;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class UpdateDebtRequest {

    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @Digits(integer = 15, fraction = 4, message = "At most 15 integer digits and 4 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

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

    public DebtRevision toRevision() {
        return DebtRevision.builder()
            .amount(Money.ofNullable(amount))
            .contactId(contactId)
            .contactName(contactName)
            .description(description)
            .dueDate(dueDate)
            .build();
    }
}
