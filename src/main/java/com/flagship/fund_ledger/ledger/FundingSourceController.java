package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.config.ApiHeaders;
import com.flagship.fund_ledger.ledger.dto.FundingSourceResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/funding-sources")
@RequiredArgsConstructor
public class FundingSourceController {

    private final TransactionQueryService queryService;

    @GetMapping
    public List<FundingSourceResponse> listFundingSources(@RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId) {
        return queryService.listFundingSources(ownerId).stream()
            .map(FundingSourceResponse::from)
            .toList();
    }
}
