package com.flagship.fund_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of events written to the outbox.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    /**
     * Transaction or debt the event is about; also the Kafka message key.
     */
    UUID getAggregateId();

    String getAggregateType();

    Instant getOccurredAt();

    String getEventType();
}
