package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.config.ApiHeaders;
import com.flagship.fund_ledger.debt.dto.CreateDebtRequest;
import com.flagship.fund_ledger.debt.dto.DebtPaymentRequest;
import com.flagship.fund_ledger.debt.dto.DebtResponse;
import com.flagship.fund_ledger.debt.dto.DebtSummaryResponse;
import com.flagship.fund_ledger.debt.dto.MarkPaidRequest;
import com.flagship.fund_ledger.debt.dto.UpdateDebtRequest;
import com.flagship.fund_ledger.ledger.TransactionQueryService;
import com.flagship.fund_ledger.ledger.dto.TransactionResponse;
import com.flagship.fund_ledger.money.Money;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/debts")
@RequiredArgsConstructor
public class DebtController {

    private final DebtService debtService;
    private final TransactionQueryService queryService;

    @PostMapping
    public ResponseEntity<DebtResponse> createDebt(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @Valid @RequestBody CreateDebtRequest request) {
        DebtPayment opened = debtService.createDebt(ownerId, request.toIntent());
        return ResponseEntity.status(HttpStatus.CREATED).body(DebtResponse.from(opened));
    }

    @GetMapping
    public List<DebtResponse> listDebts(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @RequestParam(value = "includePaid", defaultValue = "false") boolean includePaid) {
        return debtService.listDebts(ownerId, includePaid).stream()
            .map(DebtResponse::from)
            .toList();
    }

    @GetMapping("/summary")
    public DebtSummaryResponse getSummary(@RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId) {
        return DebtSummaryResponse.from(debtService.getDebtSummary(ownerId));
    }

    @GetMapping("/{id}")
    public DebtResponse getDebt(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id) {
        return DebtResponse.from(debtService.getDebt(ownerId, id));
    }

    @GetMapping("/{id}/transactions")
    public List<TransactionResponse> getDebtTransactions(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id) {
        debtService.getDebt(ownerId, id);
        return queryService.getDebtTransactions(ownerId, id).stream()
            .map(TransactionResponse::from)
            .toList();
    }

    @PostMapping("/{id}/payments")
    public DebtResponse recordPayment(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody DebtPaymentRequest request) {
        return DebtResponse.from(debtService.recordDebtPayment(ownerId, id, Money.of(request.getAmount()),
                request.getAccountId(), request.getDescription()));
    }

    @PostMapping("/{id}/mark-paid")
    public DebtResponse markPaid(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id,
            @RequestBody(required = false) MarkPaidRequest request) {
        UUID accountId = request != null ? request.getAccountId() : null;
        return DebtResponse.from(debtService.markDebtPaid(ownerId, id, accountId));
    }

    @PutMapping("/{id}")
    public DebtResponse editDebt(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateDebtRequest request) {
        return DebtResponse.from(debtService.editDebt(ownerId, id, request.toRevision()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDebt(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id) {
        debtService.deleteDebt(ownerId, id);
        return ResponseEntity.noContent().build();
    }
}
