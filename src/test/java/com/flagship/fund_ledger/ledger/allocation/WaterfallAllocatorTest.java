package com.flagship.fund_ledger.ledger.allocation;

import com.flagship.fund_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WaterfallAllocatorTest {

    private final WaterfallAllocator allocator = new WaterfallAllocator();

    private static TagBalance tag(String name, String balance) {
        return new TagBalance(UUID.randomUUID(), name, Money.of(balance), Money.ZERO);
    }

    @Test
    @DisplayName("Drains the first source before touching the next")
    void drainsInOrder() {
        TagBalance gaji = tag("Gaji", "500000");
        TagBalance bonus = tag("Bonus", "200000");

        AllocationPlan plan = allocator.allocate(List.of(gaji, bonus), Money.of("600000"), false);

        assertTrue(plan.isComplete());
        assertEquals(Money.of("600000"), plan.getTotalAllocated());
        assertEquals(2, plan.getAllocations().size());
        assertEquals(gaji.getFundingSourceId(), plan.getAllocations().get(0).getFundingSourceId());
        assertEquals(Money.of("500000"), plan.getAllocations().get(0).getAmount());
        assertEquals("Bonus", plan.getAllocations().get(1).getFundingSourceName());
        assertEquals(Money.of("100000"), plan.getAllocations().get(1).getAmount());
    }

    @Test
    @DisplayName("Stops as soon as the target is covered")
    void stopsWhenCovered() {
        AllocationPlan plan = allocator.allocate(
            List.of(tag("A", "300"), tag("B", "300"), tag("C", "300")), Money.of("300"), false);

        assertEquals(1, plan.getAllocations().size());
        assertEquals(Money.ZERO, plan.getShortfall());
    }

    @Test
    @DisplayName("Shortfall without permission reports requested and available")
    void shortfallRejected() {
        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> allocator.allocate(List.of(tag("A", "100000"), tag("B", "200000")), Money.of("1000000"), false));

        assertEquals(Money.of("1000000"), e.getRequested());
        assertEquals(Money.of("300000"), e.getAvailable());
    }

    @Test
    @DisplayName("Shortfall with permission returns the partial plan")
    void shortfallAllowed() {
        AllocationPlan plan = allocator.allocate(List.of(tag("A", "100")), Money.of("250"), true);

        assertFalse(plan.isComplete());
        assertEquals(Money.of("100"), plan.getTotalAllocated());
        assertEquals(Money.of("150"), plan.getShortfall());
    }

    @Test
    @DisplayName("Empty input with shortfall allowed allocates nothing")
    void emptyInput() {
        AllocationPlan plan = allocator.allocate(List.of(), Money.of("10"), true);

        assertTrue(plan.getAllocations().isEmpty());
        assertEquals(Money.of("10"), plan.getShortfall());
    }

    @Test
    @DisplayName("Non-positive targets are rejected")
    void rejectsNonPositiveTarget() {
        assertThrows(ValidationException.class, () -> allocator.allocate(List.of(), Money.ZERO, true));
        assertThrows(ValidationException.class, () -> allocator.allocate(List.of(), Money.of("-1"), true));
    }

    @Test
    @DisplayName("Same input always yields the same plan")
    void deterministic() {
        List<TagBalance> balances = List.of(tag("A", "70"), tag("B", "50"), tag("C", "20"));

        AllocationPlan first = allocator.allocate(balances, Money.of("100"), false);
        AllocationPlan second = allocator.allocate(balances, Money.of("100"), false);

        assertEquals(first, second);
    }
}
