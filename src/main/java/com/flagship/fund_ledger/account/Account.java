package com.flagship.fund_ledger.account;

import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A named money container.
 *
 * The stored balance equals the sum of every applied transaction effect touching
 * the account. It is only changed through {@code AccountRepository}'s increment and
 * conditional decrement statements.
 */
@Value
public class Account {
    UUID id;
    UUID ownerId;
    String name;
    AccountKind kind;
    Money balance;
    Money creditLimit;      // CREDIT only, null otherwise
    Integer statementDay;   // CREDIT only, 1..31
    Integer dueDay;         // CREDIT only, 1..31
    Instant createdAt;
    Instant updatedAt;

    /**
     * Lowest balance a decrement may leave behind: zero, or minus the credit limit
     * for CREDIT accounts that have one.
     */
    public Money balanceFloor() {
        if (kind.isCredit() && creditLimit != null) {
            return creditLimit.negate();
        }
        return Money.ZERO;
    }

    /**
     * How much can be drawn before hitting {@link #balanceFloor()}.
     */
    public Money spendable() {
        return balance.minus(balanceFloor()).max(Money.ZERO);
    }
}
