package com.flagship.fund_ledger.account;

import com.flagship.fund_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

/**
 * Input for opening an account. Credit fields only apply to CREDIT accounts.
 */
@Value
@Builder
public class AccountDraft {
    String name;
    AccountKind kind;
    Money openingBalance;
    Money creditLimit;
    Integer statementDay;
    Integer dueDay;
}
