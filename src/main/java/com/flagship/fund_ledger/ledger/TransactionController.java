package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.config.ApiHeaders;
import com.flagship.fund_ledger.ledger.dto.TransactionRequest;
import com.flagship.fund_ledger.ledger.dto.TransactionResponse;
import com.flagship.fund_ledger.observability.LedgerMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.UUID;

/**
 * REST endpoints for transactions.
 *
 * Creation is idempotent when the client sends an {@code Idempotency-Key}: a repeated
 * key answers 200 with the transaction created the first time instead of 201 with a
 * new one. The unique index on (owner, key) settles two racing first requests.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final TransactionApplyService applyService;
    private final TransactionEditService editService;
    private final TransactionQueryService queryService;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    @PostMapping
    public ResponseEntity<TransactionResponse> createTransaction(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody TransactionRequest request) {

        log.info("Received {} of {} (idempotencyKey={})", request.getKind(), request.getAmount(), idempotencyKey);

        if (idempotencyKey != null) {
            Optional<UUID> existing = idempotencyService.findTransactionId(ownerId, idempotencyKey);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning transaction {}", existing.get());
                return ResponseEntity.ok(TransactionResponse.from(queryService.getTransaction(ownerId, existing.get())));
            }
            metrics.recordIdempotencyMiss();
        }

        Transaction created;
        try {
            created = applyService.createTransaction(ownerId, request.toIntent(idempotencyKey));
        } catch (DataIntegrityViolationException e) {
            Optional<UUID> winner = idempotencyKey != null
                    ? idempotencyService.findTransactionId(ownerId, idempotencyKey)
                    : Optional.empty();
            if (winner.isEmpty()) {
                throw e;
            }
            log.info("Lost idempotency race, returning transaction {}", winner.get());
            return ResponseEntity.ok(TransactionResponse.from(queryService.getTransaction(ownerId, winner.get())));
        }

        if (idempotencyKey != null) {
            idempotencyService.remember(ownerId, idempotencyKey, created.getId());
        }
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(TransactionResponse.from(queryService.getTransaction(ownerId, created.getId())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(TransactionResponse.from(queryService.getTransaction(ownerId, id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<TransactionResponse> editTransaction(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody TransactionRequest request) {
        editService.editTransaction(ownerId, id, request.toIntent(null));
        return ResponseEntity.ok(TransactionResponse.from(queryService.getTransaction(ownerId, id)));
    }
}
