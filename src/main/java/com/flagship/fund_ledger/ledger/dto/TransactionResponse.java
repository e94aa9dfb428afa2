package com.flagship.fund_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.FundingAllocation;
import com.flagship.fund_ledger.ledger.LineItem;
import com.flagship.fund_ledger.ledger.Transaction;
import com.flagship.fund_ledger.ledger.TransactionDetail;
import com.flagship.fund_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    @JsonProperty("category")
    String category;

    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("destination_account_id")
    UUID destinationAccountId;

    @JsonProperty("debt_id")
    UUID debtId;

    @JsonProperty("allocations")
    List<Allocation> allocations;

    @JsonProperty("items")
    List<Item> items;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransactionResponse from(TransactionDetail detail) {
        Transaction t = detail.getTransaction();
        return TransactionResponse.builder()
            .id(t.getId())
            .kind(t.getKind())
            .amount(t.getAmount().toBigDecimal())
            .date(t.getDate())
            .description(t.getDescription())
            .category(t.getCategoryName())
            .sourceAccountId(t.getSourceAccountId())
            .destinationAccountId(t.getDestinationAccountId())
            .debtId(t.getDebtId())
            .allocations(detail.getAllocations().stream().map(Allocation::from).toList())
            .items(detail.getItems().stream().map(Item::from).toList())
            .createdAt(t.getCreatedAt())
            .updatedAt(t.getUpdatedAt())
            .build();
    }

    @Value
    public static class Allocation {
        @JsonProperty("funding_source_id")
        UUID fundingSourceId;

        @JsonProperty("funding_source")
        String fundingSource;

        @JsonProperty("amount")
        BigDecimal amount;

        static Allocation from(FundingAllocation allocation) {
            return new Allocation(allocation.getFundingSourceId(), allocation.getFundingSourceName(),
                    allocation.getAmount().toBigDecimal());
        }
    }

    @Value
    public static class Item {
        @JsonProperty("name")
        String name;

        @JsonProperty("unit_price")
        BigDecimal unitPrice;

        @JsonProperty("quantity")
        int quantity;

        @JsonProperty("category")
        String category;

        @JsonProperty("total")
        BigDecimal total;

        static Item from(LineItem item) {
            return new Item(item.getName(), item.getUnitPrice().toBigDecimal(), item.getQuantity(),
                    item.getCategoryName(), item.total().toBigDecimal());
        }
    }
}
