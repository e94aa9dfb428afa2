package com.flagship.fund_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.account.AccountDraft;
import com.flagship.fund_ledger.account.AccountKind;
import com.flagship.fund_ledger.money.Money;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    AccountKind kind;

    @Digits(integer = 15, fraction = 4, message = "At most 15 integer digits and 4 decimal places")
    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @DecimalMin(value = "0", message = "Credit limit must not be negative")
    @Digits(integer = 15, fraction = 4, message = "At most 15 integer digits and 4 decimal places")
    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @Min(1)
    @Max(31)
    @JsonProperty("statement_day")
    Integer statementDay;

    @Min(1)
    @Max(31)
    @JsonProperty("due_day")
    Integer dueDay;

    public AccountDraft toDraft() {
        return AccountDraft.builder()
            .name(name)
            .kind(kind)
            .openingBalance(Money.ofNullable(openingBalance))
            .creditLimit(Money.ofNullable(creditLimit))
            .statementDay(statementDay)
            .dueDay(dueDay)
            .build();
    }
}
