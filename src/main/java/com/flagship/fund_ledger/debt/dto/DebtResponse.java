package com.flagship.fund_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.debt.Debt;
import com.flagship.fund_ledger.debt.DebtDirection;
import com.flagship.fund_ledger.debt.DebtPayment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DebtResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("direction")
    DebtDirection direction;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("remaining")
    BigDecimal remaining;

    @JsonProperty("paid")
    boolean paid;

    @JsonProperty("contact_id")
    UUID contactId;

    @JsonProperty("contact_name")
    String contactName;

    @JsonProperty("description")
    String description;

    @JsonProperty("due_date")
    LocalDate dueDate;

    /** Transaction written by the request, if it moved money. */
    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static DebtResponse from(Debt debt) {
        return base(debt).build();
    }

    public static DebtResponse from(DebtPayment payment) {
        return base(payment.getDebt())
            .transactionId(payment.getTransaction() != null ? payment.getTransaction().getId() : null)
            .build();
    }

    private static DebtResponseBuilder base(Debt debt) {
        return DebtResponse.builder()
            .id(debt.getId())
            .direction(debt.getDirection())
            .amount(debt.getAmount().toBigDecimal())
            .remaining(debt.getRemaining().toBigDecimal())
            .paid(debt.isPaid())
            .contactId(debt.getContactId())
            .contactName(debt.getContactName())
            .description(debt.getDescription())
            .dueDate(debt.getDueDate())
            .createdAt(debt.getCreatedAt())
            .updatedAt(debt.getUpdatedAt());
    }
}
