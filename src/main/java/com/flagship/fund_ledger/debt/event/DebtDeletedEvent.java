package com.flagship.fund_ledger.debt.event;

import com.flagship.fund_ledger.debt.Debt;
import com.flagship.fund_ledger.ledger.event.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The debt was removed; its transactions stay in the ledger unlinked.
 */
@Value
public class DebtDeletedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "DebtDeleted";

    UUID eventId;
    UUID debtId;
    UUID ownerId;
    String direction;
    BigDecimal amount;
    BigDecimal remaining;
    boolean paid;
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

    public static DebtDeletedEvent from(Debt debt) {
        return new DebtDeletedEvent(
            UUID.randomUUID(),
            debt.getId(),
            debt.getOwnerId(),
            debt.getDirection().name(),
            debt.getAmount().toBigDecimal(),
            debt.getRemaining().toBigDecimal(),
            debt.isPaid(),
            Instant.now()
        );
    }
}
