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
 * A new transaction was applied to balances and provenance.
 */
@Value
public class TransactionAppliedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "TransactionApplied";
    public static final String AGGREGATE_TYPE = "Transaction";

    UUID eventId;
    UUID transactionId;
    UUID ownerId;
    String kind;
    BigDecimal amount;
    LocalDate date;
    UUID sourceAccountId;
    UUID destinationAccountId;
    UUID debtId;
    List<AllocationPayload> allocations;
    Instant occurredAt;

    @Override
    public UUID getAggregateId() {
        return transactionId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionAppliedEvent from(Transaction transaction, List<FundingAllocation> allocations) {
        return new TransactionAppliedEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getOwnerId(),
            transaction.getKind().name(),
            transaction.getAmount().toBigDecimal(),
            transaction.getDate(),
            transaction.getSourceAccountId(),
            transaction.getDestinationAccountId(),
            transaction.getDebtId(),
            AllocationPayload.fromAllocations(allocations),
            Instant.now()
        );
    }
}
