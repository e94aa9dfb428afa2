package com.flagship.fund_ledger.money;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Amounts that compare equal are equal after normalization")
    void normalizesScale() {
        assertEquals(Money.of("100"), Money.of("100.0000"));
        assertEquals(Money.of(100), Money.of(new BigDecimal("100.00")));
        assertEquals(4, Money.of("1.5").toBigDecimal().scale());
    }

    @Test
    @DisplayName("Inputs with more than four decimal places are rejected, never rounded")
    void rejectsExtraPrecision() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Money.of("100.00005"));
        assertTrue(e.getMessage().contains("decimal places"));
        assertThrows(IllegalArgumentException.class, () -> Money.ofNullable(new BigDecimal("0.12345")));

        // trailing zeros beyond the scale carry no value and are accepted
        assertEquals(Money.of("100"), Money.of("100.000000"));
    }

    @Test
    @DisplayName("Inputs beyond fifteen integer digits are rejected")
    void rejectsOversizedAmounts() {
        assertThrows(IllegalArgumentException.class, () -> Money.of("1000000000000000"));
        assertThrows(IllegalArgumentException.class, () -> Money.of("-1000000000000000"));

        Money largest = Money.of("999999999999999.9999");
        assertTrue(largest.isStorable());
        assertFalse(largest.plus(Money.of("0.0001")).isStorable());
    }

    @Test
    @DisplayName("Arithmetic and comparisons are exact")
    void arithmetic() {
        Money a = Money.of("500000");
        Money b = Money.of("200000.5");

        assertEquals(Money.of("700000.5"), a.plus(b));
        assertEquals(Money.of("299999.5"), a.minus(b));
        assertEquals(Money.of("-500000"), a.negate());
        assertEquals(b, a.min(b));
        assertEquals(a, a.max(b));
        assertTrue(a.isGreaterThan(b));
        assertTrue(b.isLessThan(a));
        assertTrue(a.negate().isNegative());
        assertTrue(Money.ZERO.isZero());
        assertFalse(Money.ZERO.isPositive());
    }

    @Test
    @DisplayName("Sum of an empty collection is zero")
    void sum() {
        assertEquals(Money.ZERO, Money.sum(List.of()));
        assertEquals(Money.of("0.3"), Money.sum(List.of(Money.of("0.1"), Money.of("0.2"))));
    }

    @Test
    @DisplayName("Null input is rejected except through ofNullable")
    void nulls() {
        assertThrows(NullPointerException.class, () -> Money.of((BigDecimal) null));
        assertNull(Money.ofNullable(null));
    }
}
