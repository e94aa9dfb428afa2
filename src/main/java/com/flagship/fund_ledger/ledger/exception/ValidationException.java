package com.flagship.fund_ledger.ledger.exception;

/**
 * Malformed intent. Always raised before anything is written.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_ERROR";
    }
}
