package com.flagship.fund_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * How an outgoing transaction picks the funding sources it draws from:
 * {@link Auto} runs the waterfall, {@link Manual} carries an explicit list that must
 * sum exactly to the transaction amount.
 */
public interface FundingSelection {

    static FundingSelection auto() {
        return Auto.INSTANCE;
    }

    static FundingSelection manual(List<ManualAllocation> allocations) {
        return new Manual(List.copyOf(allocations));
    }

    final class Auto implements FundingSelection {
        private static final Auto INSTANCE = new Auto();

        private Auto() {
        }

        @Override
        public String toString() {
            return "Auto";
        }
    }

    @Value
    class Manual implements FundingSelection {
        List<ManualAllocation> allocations;
    }
}
