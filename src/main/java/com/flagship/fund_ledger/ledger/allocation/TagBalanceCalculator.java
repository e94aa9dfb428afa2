package com.flagship.fund_ledger.ledger.allocation;

import com.flagship.fund_ledger.ledger.store.FundingAllocationRepository;
import com.flagship.fund_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-account balance of every funding source, derived from allocation rows.
 *
 * Provenance follows money: a TRANSFER credits the destination with the same sources
 * it debits from the source account. Nothing is cached; every call reads the full
 * history of the account.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TagBalanceCalculator {

    /**
     * Richest first, ties broken by funding source id. This order is the waterfall's
     * draw priority.
     */
    static final Comparator<TagBalance> DRAW_ORDER =
        Comparator.comparing(TagBalance::getBalance).reversed()
            .thenComparing(tag -> tag.getFundingSourceId().toString());

    private final FundingAllocationRepository allocationRepository;

    /**
     * @return sources with a positive remaining balance in draw order
     */
    public List<TagBalance> computeTagBalances(UUID ownerId, UUID accountId) {
        List<ProvenanceMovement> movements = allocationRepository.findMovementsForAccount(ownerId, accountId);
        List<TagBalance> balances = aggregate(movements);
        log.debug("Computed {} tag balances from {} movements for account {}",
                balances.size(), movements.size(), accountId);
        return balances;
    }

    /**
     * Groups movements by source into credit and debit totals, drops sources whose
     * balance is not positive and sorts the rest in {@link #DRAW_ORDER}.
     */
    public static List<TagBalance> aggregate(List<ProvenanceMovement> movements) {
        Map<UUID, Totals> bySource = new LinkedHashMap<>();
        for (ProvenanceMovement movement : movements) {
            Totals totals = bySource.computeIfAbsent(movement.getFundingSourceId(),
                    id -> new Totals(movement.getFundingSourceName()));
            if (movement.getDirection() == ProvenanceMovement.Direction.CREDIT) {
                totals.credit = totals.credit.plus(movement.getAmount());
            } else {
                totals.debit = totals.debit.plus(movement.getAmount());
            }
        }

        return bySource.entrySet().stream()
            .map(entry -> new TagBalance(entry.getKey(), entry.getValue().name,
                    entry.getValue().credit, entry.getValue().debit))
            .filter(tag -> tag.getBalance().isPositive())
            .sorted(DRAW_ORDER)
            .toList();
    }

    private static final class Totals {
        private final String name;
        private Money credit = Money.ZERO;
        private Money debit = Money.ZERO;

        private Totals(String name) {
            this.name = name;
        }
    }
}
