package com.flagship.fund_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class DebtPaymentRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @Digits(integer = 15, fraction = 4, message = "At most 15 integer digits and 4 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;
}
