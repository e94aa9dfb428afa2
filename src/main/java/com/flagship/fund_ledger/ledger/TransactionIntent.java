package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * What the caller wants a transaction to be, for both creation and edit.
 *
 * {@code fundingSourceName} tags incoming money (INCOME and incoming REPAYMENT); it is
 * taken as given and never derived from the description. {@code fundingSelection}
 * applies to outgoing money and defaults to the waterfall.
 */
@Value
@Builder(toBuilder = true)
public class TransactionIntent {
    TransactionKind kind;
    Money amount;
    LocalDate date;
    String description;
    String categoryName;
    UUID sourceAccountId;
    UUID destinationAccountId;
    String fundingSourceName;
    @Builder.Default
    FundingSelection fundingSelection = FundingSelection.auto();
    @Builder.Default
    List<LineItem> items = List.of();
    UUID debtId;
    String idempotencyKey;
}
