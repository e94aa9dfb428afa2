package com.flagship.fund_ledger.debt.event;

import com.flagship.fund_ledger.debt.Debt;
import com.flagship.fund_ledger.ledger.event.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A payment moved money and reduced the remaining amount.
 */
@Value
public class DebtPaymentRecordedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "DebtPaymentRecorded";

    UUID eventId;
    UUID debtId;
    UUID ownerId;
    String direction;
    BigDecimal amount;
    BigDecimal remaining;
    boolean paid;
    UUID transactionId;
    BigDecimal paymentAmount;
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

    public static DebtPaymentRecordedEvent from(Debt debt, UUID transactionId, BigDecimal paymentAmount) {
        return new DebtPaymentRecordedEvent(
            UUID.randomUUID(),
            debt.getId(),
            debt.getOwnerId(),
            debt.getDirection().name(),
            debt.getAmount().toBigDecimal(),
            debt.getRemaining().toBigDecimal(),
            debt.isPaid(),
            transactionId,
            paymentAmount,
            Instant.now()
        );
    }
}
