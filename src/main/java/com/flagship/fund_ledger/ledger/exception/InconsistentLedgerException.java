package com.flagship.fund_ledger.ledger.exception;

/**
 * Stored state violates a ledger invariant (for example a transaction whose
 * allocation rows do not add up to its amount). Indicates a bug, not a user error;
 * retrying will not help.
 */
public class InconsistentLedgerException extends LedgerException {

    public InconsistentLedgerException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INCONSISTENT_LEDGER";
    }
}
