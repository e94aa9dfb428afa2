package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Signed change a transaction makes to one account's balance.
 *
 * Effects are computed, never stored: the forward effects of a transaction follow
 * from its kind, amount and accounts, and an edit applies their inverse before
 * applying the effects of the new state.
 */
@Value
public class BalanceEffect {
    UUID accountId;
    Money delta;

    public boolean isDecrement() {
        return delta.isNegative();
    }

    public BalanceEffect inverse() {
        return new BalanceEffect(accountId, delta.negate());
    }

    /**
     * Source loses the amount, destination gains it. Holds for every kind.
     */
    public static List<BalanceEffect> of(Money amount, UUID sourceAccountId, UUID destinationAccountId) {
        List<BalanceEffect> effects = new ArrayList<>(2);
        if (sourceAccountId != null) {
            effects.add(new BalanceEffect(sourceAccountId, amount.negate()));
        }
        if (destinationAccountId != null) {
            effects.add(new BalanceEffect(destinationAccountId, amount));
        }
        return effects;
    }

    public static List<BalanceEffect> of(Transaction transaction) {
        return of(transaction.getAmount(), transaction.getSourceAccountId(), transaction.getDestinationAccountId());
    }

    public static List<BalanceEffect> inverseOf(Transaction transaction) {
        return of(transaction).stream().map(BalanceEffect::inverse).toList();
    }
}
