package com.flagship.fund_ledger.account;

import com.flagship.fund_ledger.account.dto.AccountResponse;
import com.flagship.fund_ledger.account.dto.CreateAccountRequest;
import com.flagship.fund_ledger.config.ApiHeaders;
import com.flagship.fund_ledger.ledger.TransactionQueryService;
import com.flagship.fund_ledger.ledger.dto.TagBalanceResponse;
import com.flagship.fund_ledger.ledger.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final TransactionQueryService queryService;

    @Value("${ledger.history.default-limit:50}")
    private int defaultHistoryLimit;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.createAccount(ownerId, request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> listAccounts(@RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId) {
        return accountService.listAccounts(ownerId).stream()
            .map(AccountResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.getAccountDetail(ownerId, id));
    }

    @GetMapping("/{id}/tag-balances")
    public List<TagBalanceResponse> getTagBalances(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id) {
        return accountService.getTagBalances(ownerId, id).stream()
            .map(TagBalanceResponse::from)
            .toList();
    }

    /**
     * @param limit maximum entries; 0 returns the whole history
     */
    @GetMapping("/{id}/transactions")
    public List<TransactionResponse> getTransactionHistory(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return queryService.getTransactionHistory(ownerId, id, limit != null ? limit : defaultHistoryLimit).stream()
            .map(TransactionResponse::from)
            .toList();
    }
}
