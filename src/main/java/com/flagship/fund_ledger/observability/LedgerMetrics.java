package com.flagship.fund_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer meters for ledger operations.
 *
 * <ul>
 *   <li>{@code ledger.transactions.applied} / {@code .edited}, tagged by kind</li>
 *   <li>{@code ledger.transactions.rejected}, tagged by operation and error code</li>
 *   <li>{@code ledger.operation.latency}, tagged by operation and outcome</li>
 *   <li>{@code ledger.debts.opened} / {@code .payments} / {@code .settled}, tagged by direction</li>
 *   <li>{@code ledger.idempotency}, hit or miss</li>
 * </ul>
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransactionApplied(String kind) {
        registry.counter("ledger.transactions.applied", "kind", kind).increment();
    }

    public void recordTransactionEdited(String kind) {
        registry.counter("ledger.transactions.edited", "kind", kind).increment();
    }

    public void recordRejected(String operation, String errorCode) {
        registry.counter("ledger.transactions.rejected",
                "operation", operation,
                "error", sanitizeTag(errorCode)
        ).increment();
    }

    public void recordDebtOpened(String direction) {
        registry.counter("ledger.debts.opened", "direction", direction).increment();
    }

    public void recordDebtPayment(String direction) {
        registry.counter("ledger.debts.payments", "direction", direction).increment();
    }

    public void recordDebtSettled(String direction) {
        registry.counter("ledger.debts.settled", "direction", direction).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    /**
     * Times {@code operation}, tagging the sample with success or the exception type.
     */
    public <T> T time(String operation, Supplier<T> work) {
        Timer.Sample sample = Timer.start(registry);
        String outcome = "success";
        try {
            return work.get();
        } catch (RuntimeException e) {
            outcome = e.getClass().getSimpleName();
            throw e;
        } finally {
            sample.stop(Timer.builder("ledger.operation.latency")
                    .tag("operation", operation)
                    .tag("outcome", sanitizeTag(outcome))
                    .publishPercentiles(0.5, 0.95, 0.99)
                    .register(registry));
        }
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
