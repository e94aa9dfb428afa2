package com.flagship.fund_ledger.debt.event;

import com.flagship.fund_ledger.debt.Debt;
import com.flagship.fund_ledger.ledger.event.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Amount, remaining or metadata changed without a new payment.
 */
@Value
public class DebtRevisedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "DebtRevised";

    UUID eventId;
    UUID debtId;
    UUID ownerId;
    String direction;
    BigDecimal amount;
    BigDecimal remaining;
    boolean paid;
    String reason;
    Instant occurredAt;

    @Override
    public UUID getAggregateId() {
        return debtId;
    }

    @Override
    public String getAggregateType() {
        return DebtOpenedEvent.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DebtRevisedEvent from(Debt debt, String reason) {
        return new DebtRevisedEvent(
            UUID.randomUUID(),
            debt.getId(),
            debt.getOwnerId(),
            debt.getDirection().name(),
            debt.getAmount().toBigDecimal(),
            debt.getRemaining().toBigDecimal(),
            debt.isPaid(),
            reason,
            Instant.now()
        );
    }
}
