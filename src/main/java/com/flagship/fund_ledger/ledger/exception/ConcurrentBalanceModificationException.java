package com.flagship.fund_ledger.ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A conditional balance decrement matched no row: another writer moved the
 * balance after validation. Retrying the whole operation is safe.
 */
@Getter
public class ConcurrentBalanceModificationException extends LedgerException {

    private final UUID accountId;

    public ConcurrentBalanceModificationException(UUID accountId) {
        super("Balance of account " + accountId + " changed concurrently, retry the operation");
        this.accountId = accountId;
    }

    @Override
    public String getErrorCode() {
        return "CONCURRENT_MODIFICATION";
    }
}
