package com.flagship.fund_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.account.Account;
import com.flagship.fund_ledger.account.AccountDetail;
import com.flagship.fund_ledger.account.AccountKind;
import com.flagship.fund_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Account as returned by the API. The activity totals are only filled on the
 * single-account endpoint.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("kind")
    AccountKind kind;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @JsonProperty("statement_day")
    Integer statementDay;

    @JsonProperty("due_day")
    Integer dueDay;

    @JsonProperty("total_income")
    BigDecimal totalIncome;

    @JsonProperty("total_expense")
    BigDecimal totalExpense;

    @JsonProperty("transaction_count")
    Long transactionCount;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return base(account).build();
    }

    public static AccountResponse from(AccountDetail detail) {
        return base(detail.getAccount())
            .totalIncome(detail.getActivity().getTotalIncome().toBigDecimal())
            .totalExpense(detail.getActivity().getTotalExpense().toBigDecimal())
            .transactionCount(detail.getActivity().getTransactionCount())
            .build();
    }

    private static AccountResponseBuilder base(Account account) {
        Money limit = account.getCreditLimit();
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .kind(account.getKind())
            .balance(account.getBalance().toBigDecimal())
            .creditLimit(limit != null ? limit.toBigDecimal() : null)
            .statementDay(account.getStatementDay())
            .dueDay(account.getDueDay())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt());
    }
}
