package com.flagship.fund_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.debt.DebtSummary;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class DebtSummaryResponse {

    @JsonProperty("total_lent")
    BigDecimal totalLent;

    @JsonProperty("total_borrowed")
    BigDecimal totalBorrowed;

    @JsonProperty("active_lending_count")
    long activeLendingCount;

    @JsonProperty("active_borrowing_count")
    long activeBorrowingCount;

    public static DebtSummaryResponse from(DebtSummary summary) {
        return new DebtSummaryResponse(summary.getTotalLent().toBigDecimal(), summary.getTotalBorrowed().toBigDecimal(),
                summary.getActiveLendingCount(), summary.getActiveBorrowingCount());
    }
}
