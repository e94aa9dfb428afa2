package com.flagship.fund_ledger.outbox;

import com.flagship.fund_ledger.observability.CorrelationContext;
import com.flagship.fund_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Drains the outbox to the {@code ledger-events} Kafka topic.
 *
 * Each poll:
 * 1. Claims up to {@code outbox.publisher.batch-size} unpublished events with
 *    SELECT FOR UPDATE SKIP LOCKED, so several instances never claim the same row
 * 2. Sends them one at a time, keyed by aggregate id (transaction or debt id)
 * 3. Waits for the broker acknowledgement before marking an event published
 * 4. Records the error and bumps the retry count when a send fails
 *
 * Message headers:
 * - {@code eventType}: TransactionApplied, TransactionEdited, DebtOpened, ...
 * - {@code X-Correlation-ID}: the id of the request that wrote the event
 *
 * Failure handling:
 * - Per-aggregate order holds because one aggregate maps to one partition and the
 *   batch is sent in sequence order
 * - Events reaching {@code outbox.publisher.max-retries} stay in the table as dead
 *   letters and are no longer claimed; they need manual replay
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.claimBatch(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Publishing {} outbox events", events.size());
            for (OutboxEvent event : events) {
                publish(event);
            }
        } catch (Exception e) {
            log.error("Outbox polling failed", e);
        }
    }

    private void publish(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
                ledgerEventsTopic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add("eventType", event.getEventType().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                    event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, event.getCorrelationId());
        }

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published {} {} to partition {} offset {}", event.getEventType(), event.getId(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, e);
        } catch (Exception e) {
            recordFailure(event, e);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private void recordFailure(OutboxEvent event, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        int attempts = outboxService.markFailed(event.getId(), message);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (attempts >= maxRetries) {
            log.error("Event {} ({}) dead-lettered after {} attempts, aggregate {}",
                    event.getId(), event.getEventType(), attempts, event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    /**
     * Runs one polling cycle immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
