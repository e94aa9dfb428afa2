package com.flagship.fund_ledger.ledger.exception;

import com.flagship.fund_ledger.money.Money;
import lombok.Getter;

/**
 * Available provenance or account balance is short of the requested amount.
 * Carries both totals so callers can show them.
 */
@Getter
public class InsufficientFundsException extends LedgerException {

    private final Money requested;
    private final Money available;

    public InsufficientFundsException(Money requested, Money available) {
        super(String.format("Insufficient funds: requested=%s, available=%s", requested, available));
        this.requested = requested;
        this.available = available;
    }

    @Override
    public String getErrorCode() {
        return "INSUFFICIENT_FUNDS";
    }
}
