package com.flagship.fund_ledger.ledger.exception;

/**
 * Base type for every business outcome the ledger reports to its callers.
 *
 * Subclasses are expected results (bad input, missing entity, short funds, lost race)
 * except {@link InconsistentLedgerException}, which signals a broken invariant.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable code, used as the {@code error} field of API responses.
     */
    public abstract String getErrorCode();
}
