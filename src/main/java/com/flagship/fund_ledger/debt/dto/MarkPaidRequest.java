package com.flagship.fund_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Optional body of mark-paid. Without an account the debt is settled administratively.
 */
@Value
@Builder
@Jacksonized
public class MarkPaidRequest {

    @JsonProperty("account_id")
    UUID accountId;
}
