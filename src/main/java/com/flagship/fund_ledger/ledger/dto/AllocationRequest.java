package com.flagship.fund_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class AllocationRequest {

    @NotNull(message = "Funding source ID is required")
    @JsonProperty("funding_source_id")
    UUID fundingSourceId;

    @NotNull(message = "Allocation amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Allocation amount must be greater than 0")
    @Digits(integer = 15, fraction = 4, message = "At most 15 integer digits and 4 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;
}
