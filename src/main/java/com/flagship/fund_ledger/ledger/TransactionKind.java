package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.ledger.exception.ValidationException;

import java.util.UUID;

/**
 * Transaction kinds and the account fields each one requires.
 *
 * LENDING and REPAYMENT are produced only by the debt subledger.
 */
public enum TransactionKind {
    INCOME,
    EXPENSE,
    TRANSFER,
    LENDING,
    REPAYMENT;

    public boolean isDebtKind() {
        return this == LENDING || this == REPAYMENT;
    }

    /**
     * Checks the source/destination shape of this kind.
     *
     * @throws ValidationException when an account is missing, unexpected, or a
     *         transfer points at itself
     */
    public void validateAccounts(UUID sourceAccountId, UUID destinationAccountId) {
        switch (this) {
            case INCOME -> {
                require(destinationAccountId != null, "INCOME requires a destination account");
                require(sourceAccountId == null, "INCOME must not have a source account");
            }
            case EXPENSE, LENDING -> {
                require(sourceAccountId != null, this + " requires a source account");
                require(destinationAccountId == null, this + " must not have a destination account");
            }
            case TRANSFER -> {
                require(sourceAccountId != null && destinationAccountId != null,
                        "TRANSFER requires both a source and a destination account");
                require(!sourceAccountId.equals(destinationAccountId),
                        "TRANSFER source and destination must differ");
            }
            case REPAYMENT -> require((sourceAccountId == null) != (destinationAccountId == null),
                    "REPAYMENT requires exactly one of source or destination account");
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ValidationException(message);
        }
    }
}
