package com.flagship.fund_ledger.ledger.allocation;

import com.flagship.fund_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.money.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy allocator: drains funding sources in the order given, richest first when fed
 * by {@link TagBalanceCalculator}.
 *
 * Pure and deterministic. The same ordered input always yields the same plan.
 */
@Component
@Slf4j
public class WaterfallAllocator {

    /**
     * Draws {@code min(balance, remaining)} from each entry until the target is covered.
     *
     * @param orderedBalances funding source balances in priority order
     * @param target amount to cover, must be positive
     * @param allowShortfall when false, an uncovered remainder is an error
     * @return the draws, their total and the uncovered remainder
     * @throws InsufficientFundsException if the balances cannot cover the target and
     *         {@code allowShortfall} is false
     */
    public AllocationPlan allocate(List<TagBalance> orderedBalances, Money target, boolean allowShortfall) {
        if (target == null || !target.isPositive()) {
            throw new ValidationException("Allocation target must be positive");
        }

        List<SourceAmount> draws = new ArrayList<>();
        Money remaining = target;

        for (TagBalance tag : orderedBalances) {
            if (remaining.isZero()) {
                break;
            }
            Money draw = tag.getBalance().min(remaining);
            if (!draw.isPositive()) {
                continue;
            }
            draws.add(new SourceAmount(tag.getFundingSourceId(), tag.getName(), draw));
            remaining = remaining.minus(draw);
        }

        Money allocated = target.minus(remaining);
        if (remaining.isPositive() && !allowShortfall) {
            log.debug("Waterfall short: target={}, available={}", target, allocated);
            throw new InsufficientFundsException(target, allocated);
        }

        return new AllocationPlan(List.copyOf(draws), allocated, remaining);
    }
}
