package com.flagship.fund_ledger.account;

import com.flagship.fund_ledger.ledger.store.AccountActivity;
import lombok.Value;

@Value
public class AccountDetail {
    Account account;
    AccountActivity activity;
}
