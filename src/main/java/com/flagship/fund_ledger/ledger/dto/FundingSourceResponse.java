package com.flagship.fund_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.FundingSource;
import lombok.Value;

import java.util.UUID;

@Value
public class FundingSourceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("category")
    FundingSource.Category category;

    public static FundingSourceResponse from(FundingSource source) {
        return new FundingSourceResponse(source.getId(), source.getName(), source.getCategory());
    }
}
