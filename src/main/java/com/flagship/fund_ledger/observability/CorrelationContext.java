package com.flagship.fund_ledger.observability;

import java.util.UUID;

/**
 * Thread-bound correlation id plus the MDC keys the ledger logs under.
 *
 * The id arrives with the HTTP request (or is generated), is stamped on every log
 * line through MDC and travels with outbox events as a Kafka header.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String DEBT_ID_MDC_KEY = "debtId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current id, generating one for work that did not start from a request.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form keeps log lines readable.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
