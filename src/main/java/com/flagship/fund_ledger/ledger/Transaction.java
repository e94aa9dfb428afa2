package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A stored transaction row.
 *
 * Edits rewrite the row in place, so {@code id} and {@code createdAt} survive an
 * edit while {@code updatedAt} moves.
 */
@Value
public class Transaction {
    UUID id;
    UUID ownerId;
    TransactionKind kind;
    Money amount;
    LocalDate date;
    String description;
    UUID categoryId;
    String categoryName;
    UUID sourceAccountId;
    UUID destinationAccountId;
    UUID debtId;
    String idempotencyKey;
    Instant createdAt;
    Instant updatedAt;

    /**
     * True when money leaves {@code sourceAccountId} carrying provenance, so the
     * transaction must own allocation rows summing to its amount.
     * LENDING decrements its source without consuming provenance.
     */
    public boolean drawsProvenance() {
        return sourceAccountId != null && kind != TransactionKind.LENDING;
    }

    /**
     * True when the destination receives a freshly tagged amount (one allocation row)
     * rather than provenance moved from another account.
     */
    public boolean tagsIncomingFunds() {
        return kind == TransactionKind.INCOME || (kind == TransactionKind.REPAYMENT && destinationAccountId != null);
    }
}
