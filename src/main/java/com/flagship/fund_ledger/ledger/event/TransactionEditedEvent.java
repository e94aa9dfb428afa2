package com.flagship.fund_ledger.ledger.event;

import com.flagship.fund_ledger.ledger.FundingAllocation;
import com.flagship.fund_ledger.ledger.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A transaction was rolled back and reapplied with new fields.
 * Carries the amount before and after so consumers can reconcile without a lookup.
 */
@Value
public class TransactionEditedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "TransactionEdited";

    UUID eventId;
    UUID transactionId;
    UUID ownerId;
    String previousKind;
    String kind;
    BigDecimal previousAmount;
    BigDecimal amount;
    LocalDate date;
    UUID sourceAccountId;
    UUID destinationAccountId;
    List<AllocationPayload> allocations;
    Instant occurredAt;

    @Override
    public UUID getAggregateId() {
        return transactionId;
    }

    @Override
    public String getAggregateType() {
        return TransactionAppliedEvent.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionEditedEvent from(Transaction before, Transaction after, List<FundingAllocation> allocations) {
        return new TransactionEditedEvent(
            UUID.randomUUID(),
            after.getId(),
            after.getOwnerId(),
            before.getKind().name(),
            after.getKind().name(),
            before.getAmount().toBigDecimal(),
            after.getAmount().toBigDecimal(),
            after.getDate(),
            after.getSourceAccountId(),
            after.getDestinationAccountId(),
            AllocationPayload.fromAllocations(allocations),
            Instant.now()
        );
    }
}
