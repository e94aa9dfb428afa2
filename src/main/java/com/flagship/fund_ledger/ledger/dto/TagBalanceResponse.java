package com.flagship.fund_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.allocation.TagBalance;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class TagBalanceResponse {

    @JsonProperty("funding_source_id")
    UUID fundingSourceId;

    @JsonProperty("name")
    String name;

    @JsonProperty("credit")
    BigDecimal credit;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("balance")
    BigDecimal balance;

    public static TagBalanceResponse from(TagBalance tag) {
        return new TagBalanceResponse(tag.getFundingSourceId(), tag.getName(), tag.getCredit().toBigDecimal(),
                tag.getDebit().toBigDecimal(), tag.getBalance().toBigDecimal());
    }
}
