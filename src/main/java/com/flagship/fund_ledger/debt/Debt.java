package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Debt domain object.
 *
 * State machine: active (remaining &gt; 0) moves to active with a smaller remaining,
 * or to paid (remaining = 0). Every transition returns a new instance and checks
 * {@code 0 <= remaining <= amount}; {@code paid} is always derived from remaining.
 */
@Value
public class Debt {
    UUID id;
    UUID ownerId;
    DebtDirection direction;
    Money amount;
    Money remaining;
    UUID contactId;
    String contactName;
    String description;
    LocalDate dueDate;
    boolean paid;
    Instant createdAt;
    Instant updatedAt;

    public static Debt open(UUID ownerId, DebtDirection direction, Money amount, UUID contactId,
                            String contactName, String description, LocalDate dueDate) {
        if (direction == null) {
            throw new ValidationException("Debt direction is required");
        }
        if (amount == null || !amount.isPositive()) {
            throw new ValidationException("Debt amount must be positive");
        }
        return new Debt(UUID.randomUUID(), ownerId, direction, amount, amount, contactId, contactName,
                description, dueDate, false, null, null);
    }

    /**
     * Applies a payment against the remaining amount.
     *
     * @throws ValidationException if the debt is paid or the payment exceeds what is left
     */
    public Debt recordPayment(Money payment) {
        if (paid) {
            throw new ValidationException("Debt " + id + " is already paid");
        }
        if (payment == null || !payment.isPositive()) {
            throw new ValidationException("Payment amount must be positive");
        }
        if (payment.isGreaterThan(remaining)) {
            throw new ValidationException(
                String.format("Payment %s exceeds remaining %s", payment, remaining));
        }
        return withBalances(amount, remaining.minus(payment));
    }

    /**
     * Administrative settlement: remaining drops to zero with no money moving.
     */
    public Debt settle() {
        if (paid) {
            throw new ValidationException("Debt " + id + " is already paid");
        }
        return withBalances(amount, Money.ZERO);
    }

    /**
     * A linked repayment changed from {@code oldPayment} to {@code newPayment}.
     */
    public Debt revisePayment(Money oldPayment, Money newPayment) {
        return withBalances(amount, remaining.minus(newPayment.minus(oldPayment)));
    }

    /**
     * The disbursement that opened the debt changed from {@code oldPrincipal} to
     * {@code newPrincipal}; amount and remaining move together.
     */
    public Debt revisePrincipal(Money oldPrincipal, Money newPrincipal) {
        Money delta = newPrincipal.minus(oldPrincipal);
        return withBalances(amount.plus(delta), remaining.plus(delta));
    }

    /**
     * Metadata edit. A new amount moves remaining by the same delta, never below zero.
     */
    public Debt revise(Money newAmount, UUID newContactId, String newContactName,
                       String newDescription, LocalDate newDueDate) {
        Money targetAmount = newAmount != null ? newAmount : amount;
        if (!targetAmount.isPositive()) {
            throw new ValidationException("Debt amount must be positive");
        }
        Money targetRemaining = remaining.plus(targetAmount.minus(amount)).max(Money.ZERO);
        Debt rebalanced = withBalances(targetAmount, targetRemaining);
        return new Debt(id, ownerId, direction, rebalanced.amount, rebalanced.remaining,
                newContactId != null ? newContactId : contactId,
                newContactId != null ? newContactName : contactName,
                newDescription, newDueDate, rebalanced.paid, createdAt, updatedAt);
    }

    private Debt withBalances(Money newAmount, Money newRemaining) {
        if (!newAmount.isPositive()) {
            throw new ValidationException("Debt amount must stay positive, got " + newAmount);
        }
        if (newRemaining.isNegative() || newRemaining.isGreaterThan(newAmount)) {
            throw new ValidationException(
                String.format("Debt remaining %s must stay within 0 and amount %s", newRemaining, newAmount));
        }
        return new Debt(id, ownerId, direction, newAmount, newRemaining, contactId, contactName,
                description, dueDate, newRemaining.isZero(), createdAt, updatedAt);
    }
}
