package com.flagship.fund_ledger.debt.event;

import com.flagship.fund_ledger.debt.Debt;
import com.flagship.fund_ledger.ledger.event.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Remaining reached zero, by payment or administratively (no transaction).
 */
@Value
public class DebtSettledEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "DebtSettled";

    UUID eventId;
    UUID debtId;
    UUID ownerId;
    String direction;
    BigDecimal amount;
    BigDecimal remaining;
    boolean paid;
    UUID transactionId;
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

    public static DebtSettledEvent from(Debt debt, UUID transactionId) {
        return new DebtSettledEvent(
            UUID.randomUUID(),
            debt.getId(),
            debt.getOwnerId(),
            debt.getDirection().name(),
            debt.getAmount().toBigDecimal(),
            debt.getRemaining().toBigDecimal(),
            debt.isPaid(),
            transactionId,
            Instant.now()
        );
    }
}
