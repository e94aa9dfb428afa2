package com.flagship.fund_ledger.ledger.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fund_ledger.config.JacksonConfig;
import com.flagship.fund_ledger.ledger.IdempotencyService;
import com.flagship.fund_ledger.ledger.Transaction;
import com.flagship.fund_ledger.ledger.TransactionApplyService;
import com.flagship.fund_ledger.ledger.TransactionController;
import com.flagship.fund_ledger.ledger.TransactionDetail;
import com.flagship.fund_ledger.ledger.TransactionEditService;
import com.flagship.fund_ledger.ledger.TransactionKind;
import com.flagship.fund_ledger.ledger.TransactionQueryService;
import com.flagship.fund_ledger.money.Money;
import com.flagship.fund_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP mapping of ledger outcomes, exercised through the transaction endpoints with
 * the services mocked out.
 */
class GlobalExceptionHandlerTest {

    private static final String EXPENSE_BODY = """
        {"kind":"EXPENSE","amount":300000,"source_account_id":"%s"}
        """;

    private final UUID ownerId = UUID.randomUUID();
    private final UUID accountId = UUID.randomUUID();

    private TransactionApplyService applyService;
    private TransactionEditService editService;
    private TransactionQueryService queryService;
    private IdempotencyService idempotencyService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        applyService = mock(TransactionApplyService.class);
        editService = mock(TransactionEditService.class);
        queryService = mock(TransactionQueryService.class);
        idempotencyService = mock(IdempotencyService.class);
        ObjectMapper objectMapper = new JacksonConfig().objectMapper();

        TransactionController controller = new TransactionController(applyService, editService, queryService,
                idempotencyService, new LedgerMetrics(new SimpleMeterRegistry()));

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
            .build();
    }

    private TransactionDetail expenseDetail(UUID id) {
        Transaction transaction = new Transaction(id, ownerId, TransactionKind.EXPENSE, Money.of("300000"),
                LocalDate.of(2024, 3, 1), null, null, null, accountId, null, null, "key-1", null, null);
        return new TransactionDetail(transaction, List.of(), List.of());
    }

    @Test
    @DisplayName("Missing owner header is a 400 naming the header")
    void missingOwnerHeader() throws Exception {
        mockMvc.perform(post("/api/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(EXPENSE_BODY.formatted(accountId)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MISSING_HEADER"));
    }

    @Test
    @DisplayName("Malformed owner header is a 400")
    void malformedOwnerHeader() throws Exception {
        mockMvc.perform(get("/api/transactions/" + UUID.randomUUID())
                .header("X-Owner-Id", "not-a-uuid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Bean validation failures list the offending fields")
    void beanValidation() throws Exception {
        mockMvc.perform(post("/api/transactions")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"kind\":\"EXPENSE\",\"amount\":-5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.amount").exists());

        verify(applyService, never()).createTransaction(any(), any());
    }

    @Test
    @DisplayName("Insufficient funds is a 422 carrying both totals")
    void insufficientFunds() throws Exception {
        when(applyService.createTransaction(eq(ownerId), any()))
            .thenThrow(new InsufficientFundsException(Money.of("300000"), Money.of("120000")));

        mockMvc.perform(post("/api/transactions")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(EXPENSE_BODY.formatted(accountId)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_FUNDS"))
            .andExpect(jsonPath("$.details.requested").value("300000.0000"))
            .andExpect(jsonPath("$.details.available").value("120000.0000"));
    }

    @Test
    @DisplayName("Allocation mismatch is a 422")
    void allocationMismatch() throws Exception {
        when(applyService.createTransaction(eq(ownerId), any()))
            .thenThrow(new AllocationMismatchException(Money.of("100"), Money.of("300000")));

        mockMvc.perform(post("/api/transactions")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(EXPENSE_BODY.formatted(accountId)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("ALLOCATION_MISMATCH"));
    }

    @Test
    @DisplayName("Lost balance race is a retryable 409")
    void concurrentModification() throws Exception {
        when(applyService.createTransaction(eq(ownerId), any()))
            .thenThrow(new ConcurrentBalanceModificationException(accountId));

        mockMvc.perform(post("/api/transactions")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(EXPENSE_BODY.formatted(accountId)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.details.retryable").value("true"));
    }

    @Test
    @DisplayName("A deadlock on account rows is a retryable 409")
    void lockFailure() throws Exception {
        when(applyService.createTransaction(eq(ownerId), any()))
            .thenThrow(new PessimisticLockingFailureException("deadlock detected"));

        mockMvc.perform(post("/api/transactions")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(EXPENSE_BODY.formatted(accountId)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("CONCURRENT_MODIFICATION"))
            .andExpect(jsonPath("$.details.retryable").value("true"));
    }

    @Test
    @DisplayName("Amounts with more than four decimals or fifteen integer digits are a 400")
    void amountOutOfPrecision() throws Exception {
        mockMvc.perform(post("/api/transactions")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"kind": "EXPENSE", "amount": 100.00005, "source_account_id": "%s"}
                    """.formatted(accountId)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.amount").exists());

        mockMvc.perform(post("/api/transactions")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"kind": "EXPENSE", "amount": 1000000000000000, "source_account_id": "%s"}
                    """.formatted(accountId)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.amount").exists());

        verifyNoInteractions(applyService);
    }

    @Test
    @DisplayName("Unknown transaction is a 404")
    void notFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(queryService.getTransaction(ownerId, id)).thenThrow(new NotFoundException("Transaction", id));

        mockMvc.perform(get("/api/transactions/" + id).header("X-Owner-Id", ownerId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Inconsistent ledger on edit is a 500 without internal detail")
    void inconsistentLedger() throws Exception {
        UUID id = UUID.randomUUID();
        when(editService.editTransaction(eq(ownerId), eq(id), any()))
            .thenThrow(new InconsistentLedgerException("allocations sum to 0 for amount 300000"));

        mockMvc.perform(put("/api/transactions/" + id)
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(EXPENSE_BODY.formatted(accountId)))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("INCONSISTENT_LEDGER"))
            .andExpect(jsonPath("$.message").value("Ledger state is inconsistent, the operation was aborted"));
    }

    @Test
    @DisplayName("A reused idempotency key answers 200 with the first transaction")
    void idempotencyHit() throws Exception {
        UUID existing = UUID.randomUUID();
        when(idempotencyService.findTransactionId(ownerId, "key-1")).thenReturn(Optional.of(existing));
        when(queryService.getTransaction(ownerId, existing)).thenReturn(expenseDetail(existing));

        mockMvc.perform(post("/api/transactions")
                .header("X-Owner-Id", ownerId)
                .header("Idempotency-Key", "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(EXPENSE_BODY.formatted(accountId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(existing.toString()));

        verify(applyService, never()).createTransaction(any(), any());
    }

    @Test
    @DisplayName("A fresh key creates the transaction with 201 and is remembered")
    void idempotencyMiss() throws Exception {
        UUID created = UUID.randomUUID();
        TransactionDetail detail = expenseDetail(created);
        when(idempotencyService.findTransactionId(ownerId, "key-1")).thenReturn(Optional.empty());
        when(applyService.createTransaction(eq(ownerId), any())).thenReturn(detail.getTransaction());
        when(queryService.getTransaction(ownerId, created)).thenReturn(detail);

        mockMvc.perform(post("/api/transactions")
                .header("X-Owner-Id", ownerId)
                .header("Idempotency-Key", "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(EXPENSE_BODY.formatted(accountId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.kind").value("EXPENSE"));

        verify(idempotencyService).remember(ownerId, "key-1", created);
    }
}
