package com.flagship.fund_ledger.outbox;

import com.flagship.fund_ledger.debt.Debt;
import com.flagship.fund_ledger.debt.DebtDirection;
import com.flagship.fund_ledger.debt.event.DebtDeletedEvent;
import com.flagship.fund_ledger.debt.event.DebtOpenedEvent;
import com.flagship.fund_ledger.ledger.event.LedgerEvent;
import com.flagship.fund_ledger.money.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox bookkeeping: recording inside a transaction, claiming, and retry tracking.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("kafka.topic.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private Debt debt;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
        debt = Debt.open(UUID.randomUUID(), DebtDirection.LENDING, Money.of("50000"), UUID.randomUUID(),
                "Budi", null, null);
    }

    private OutboxEvent recordInTransaction(LedgerEvent event) {
        return transactionTemplate.execute(status -> outboxService.record(event));
    }

    @Test
    @DisplayName("Recording outside a transaction is refused")
    void requiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.record(DebtDeletedEvent.from(debt)));
        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Recorded events keep aggregate order and carry a JSON payload")
    void recordAndRead() {
        recordInTransaction(DebtOpenedEvent.from(debt, UUID.randomUUID()));
        recordInTransaction(DebtDeletedEvent.from(debt));

        List<OutboxEvent> events = outboxService.getEventsForAggregate(DebtOpenedEvent.AGGREGATE_TYPE, debt.getId());

        assertEquals(List.of(DebtOpenedEvent.EVENT_TYPE, DebtDeletedEvent.EVENT_TYPE),
            events.stream().map(OutboxEvent::getEventType).toList());
        assertTrue(events.get(0).getPayload().contains("LENDING"));
        assertFalse(events.get(0).isPublished());
        assertEquals(2, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("An event rolled back with its transaction is never written")
    void rolledBackWithCaller() {
        assertThrows(IllegalStateException.class, () -> transactionTemplate.execute(status -> {
            outboxService.record(DebtDeletedEvent.from(debt));
            throw new IllegalStateException("business step failed");
        }));

        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Published events leave the claimable set")
    void markPublished() {
        OutboxEvent event = recordInTransaction(DebtDeletedEvent.from(debt));

        outboxService.markPublished(event.getId());

        assertTrue(outboxService.claimBatch(10, 5).isEmpty());
        assertEquals(0, outboxService.countUnpublished());
        assertTrue(outboxService.getEventsForAggregate(DebtOpenedEvent.AGGREGATE_TYPE, debt.getId())
            .get(0).isPublished());
    }

    @Test
    @DisplayName("Failures are counted until the event is dead-lettered")
    void retriesUntilDeadLetter() {
        OutboxEvent event = recordInTransaction(DebtDeletedEvent.from(debt));
        int maxRetries = 3;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            assertEquals(1, outboxService.claimBatch(10, maxRetries).size());
            assertEquals(attempt, outboxService.markFailed(event.getId(), "broker down"));
        }

        assertTrue(outboxService.claimBatch(10, maxRetries).isEmpty());
        OutboxEvent stored = outboxService.getEventsForAggregate(DebtOpenedEvent.AGGREGATE_TYPE, debt.getId()).get(0);
        assertTrue(stored.isDeadLettered(maxRetries));
        assertEquals("broker down", stored.getLastError());
        assertEquals(1, outboxService.countUnpublished());
    }
}
