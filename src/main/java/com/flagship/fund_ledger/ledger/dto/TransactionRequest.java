package com.flagship.fund_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.FundingSelection;
import com.flagship.fund_ledger.ledger.LineItem;
import com.flagship.fund_ledger.ledger.ManualAllocation;
import com.flagship.fund_ledger.ledger.TransactionIntent;
import com.flagship.fund_ledger.ledger.TransactionKind;
import com.flagship.fund_ledger.money.Money;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Body of transaction create and edit. Without {@code allocations} outgoing money
 * is allocated by the waterfall.
 */
@Value
@Builder
@Jacksonized
public class TransactionRequest {

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    TransactionKind kind;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @Digits(integer = 15, fraction = 4, message = "At most 15 integer digits and 4 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;

    @Size(max = 100)
    @JsonProperty("category")
    String category;

    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("destination_account_id")
    UUID destinationAccountId;

    @Size(max = 200)
    @JsonProperty("funding_source")
    String fundingSource;

    @Valid
    @JsonProperty("allocations")
    List<AllocationRequest> allocations;

    @Valid
    @JsonProperty("items")
    List<LineItemRequest> items;

    public TransactionIntent toIntent(String idempotencyKey) {
        return TransactionIntent.builder()
            .kind(kind)
            .amount(Money.ofNullable(amount))
            .date(date)
            .description(description)
            .categoryName(category)
            .sourceAccountId(sourceAccountId)
            .destinationAccountId(destinationAccountId)
            .fundingSourceName(fundingSource)
            .fundingSelection(allocations == null
                ? FundingSelection.auto()
                : FundingSelection.manual(allocations.stream()
                    .map(a -> new ManualAllocation(a.getFundingSourceId(), Money.ofNullable(a.getAmount())))
                    .toList()))
            .items(items == null ? List.of() : items.stream()
                .map(i -> new LineItem(i.getName(), Money.ofNullable(i.getUnitPrice()), i.getQuantity(), i.getCategory()))
                .toList())
            .idempotencyKey(idempotencyKey)
            .build();
    }
}
