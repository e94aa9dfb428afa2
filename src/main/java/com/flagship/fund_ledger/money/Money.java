package com.flagship.fund_ledger.money;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Objects;

/**
 * Exact monetary amount.
 *
 * Backed by a BigDecimal normalized to {@link #SCALE} decimal places so that two
 * amounts that compare equal are also {@code equals()}. Matches the
 * {@code numeric(19,4)} columns of the ledger schema.
 *
 * No floating point ever enters a Money: construct from strings, longs or BigDecimal.
 * Inputs are never rounded. A value with more than {@link #SCALE} decimal places, or
 * with more than {@link #MAX_INTEGER_DIGITS} integer digits, is rejected with an
 * {@link IllegalArgumentException}.
 */
@Value
public class Money implements Comparable<Money> {

    public static final int SCALE = 4;
    public static final int MAX_INTEGER_DIGITS = 15;
    public static final Money ZERO = new Money(BigDecimal.ZERO);

    /** Exclusive bound on the magnitude of any stored amount or balance. */
    public static final BigDecimal STORABLE_LIMIT = BigDecimal.TEN.pow(MAX_INTEGER_DIGITS);

    BigDecimal amount;

    private Money(BigDecimal amount) {
        // operands already carry SCALE places, so sums and differences stay exact
        this.amount = Objects.requireNonNull(amount, "amount").setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    @JsonCreator
    public static Money of(BigDecimal amount) {
        return new Money(checked(amount));
    }

    public static Money of(String amount) {
        return of(new BigDecimal(amount));
    }

    public static Money of(long amount) {
        return of(BigDecimal.valueOf(amount));
    }

    /**
     * Null-tolerant conversion for optional inputs.
     */
    public static Money ofNullable(BigDecimal amount) {
        return amount == null ? null : of(amount);
    }

    private static BigDecimal checked(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        BigDecimal scaled;
        try {
            scaled = amount.setScale(SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                "Amount has more than " + SCALE + " decimal places: " + amount.toPlainString(), e);
        }
        if (scaled.abs().compareTo(STORABLE_LIMIT) >= 0) {
            throw new IllegalArgumentException(
                "Amount has more than " + MAX_INTEGER_DIGITS + " integer digits: " + amount.toPlainString());
        }
        return scaled;
    }

    public static Money sum(Collection<Money> amounts) {
        return amounts.stream().reduce(ZERO, Money::plus);
    }

    public Money plus(Money other) {
        return new Money(amount.add(other.amount));
    }

    public Money minus(Money other) {
        return new Money(amount.subtract(other.amount));
    }

    public Money negate() {
        return new Money(amount.negate());
    }

    public Money min(Money other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public Money max(Money other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    /**
     * False when the magnitude no longer fits a {@code numeric(19,4)} column, which
     * arithmetic on valid inputs can still produce.
     */
    public boolean isStorable() {
        return amount.abs().compareTo(STORABLE_LIMIT) < 0;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    @JsonValue
    public BigDecimal toBigDecimal() {
        return amount;
    }

    @Override
    public int compareTo(Money other) {
        return amount.compareTo(other.amount);
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
