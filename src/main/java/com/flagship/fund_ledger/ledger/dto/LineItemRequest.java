package com.flagship.fund_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
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
public class LineItemRequest {

    @NotBlank(message = "Item name is required")
    @Size(max = 200)
    @JsonProperty("name")
    String name;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0", message = "Unit price must not be negative")
    @Digits(integer = 15, fraction = 4, message = "At most 15 integer digits and 4 decimal places")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @Min(value = 1, message = "Quantity must be at least 1")
    @JsonProperty("quantity")
    int quantity;

    @Size(max = 100)
    @JsonProperty("category")
    String category;
}
