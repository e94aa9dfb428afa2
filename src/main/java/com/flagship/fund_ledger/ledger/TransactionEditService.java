package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.debt.DebtService;
import com.flagship.fund_ledger.ledger.event.TransactionEditedEvent;
import com.flagship.fund_ledger.ledger.exception.InconsistentLedgerException;
import com.flagship.fund_ledger.ledger.exception.LedgerException;
import com.flagship.fund_ledger.ledger.exception.NotFoundException;
import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.ledger.store.AccountRepository;
import com.flagship.fund_ledger.ledger.store.FundingAllocationRepository;
import com.flagship.fund_ledger.ledger.store.LineItemRepository;
import com.flagship.fund_ledger.ledger.store.TransactionRepository;
import com.flagship.fund_ledger.money.Money;
import com.flagship.fund_ledger.observability.CorrelationContext;
import com.flagship.fund_ledger.observability.LedgerMetrics;
import com.flagship.fund_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Edits a transaction by undoing its effects and applying the new intent in place.
 *
 * The row is locked for the whole edit. Old balance effects are reversed with
 * unconditional adjustments, old allocations and line items are deleted, and the
 * new intent goes through the same path as a fresh transaction. Because allocation
 * runs after the rollback, the transaction's own provenance is available again, so
 * re-submitting the current state changes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionEditService {

    private final TransactionRepository transactionRepository;
    private final FundingAllocationRepository allocationRepository;
    private final LineItemRepository lineItemRepository;
    private final AccountRepository accountRepository;
    private final TransactionApplyService applyService;
    private final DebtService debtService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    @Transactional
    public Transaction editTransaction(UUID ownerId, UUID transactionId, TransactionIntent newIntent) {
        TransactionApplyService.requireOwner(ownerId);
        if (newIntent == null) {
            throw new ValidationException("Transaction intent is required");
        }
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());
        try {
            return metrics.time("edit_transaction", () -> edit(ownerId, transactionId, newIntent));
        } catch (LedgerException e) {
            metrics.recordRejected("edit", e.getErrorCode());
            if (!(e instanceof InconsistentLedgerException)) {
                log.warn("Rejected edit: {}", e.getMessage());
            }
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private Transaction edit(UUID ownerId, UUID transactionId, TransactionIntent newIntent) {
        Transaction before = transactionRepository.findByIdForUpdate(ownerId, transactionId)
            .orElseThrow(() -> new NotFoundException("Transaction", transactionId));
        List<FundingAllocation> oldAllocations = allocationRepository.findByTransactionId(transactionId);
        verifyConsistent(before, oldAllocations);

        boolean debtLinked = before.getKind().isDebtKind() || before.getDebtId() != null;
        TransactionIntent effective = debtLinked
                ? constrainDebtLinked(before, oldAllocations, newIntent)
                : constrainPlain(before, oldAllocations, newIntent);

        for (BalanceEffect effect : BalanceEffect.inverseOf(before)) {
            accountRepository.adjustBalance(effect.getAccountId(), effect.getDelta());
        }
        allocationRepository.deleteByTransactionId(transactionId);
        lineItemRepository.deleteByTransactionId(transactionId);
        log.debug("Rolled back {} of {} ({} allocations)", before.getKind(), before.getAmount(), oldAllocations.size());

        AppliedTransaction applied = applyService.apply(ownerId, transactionId, effective, before);
        Transaction after = applied.getTransaction();

        debtService.applyLinkedTransactionEdit(ownerId, before, after);

        outboxService.record(TransactionEditedEvent.from(before, after, applied.getAllocations()));
        metrics.recordTransactionEdited(after.getKind().name());
        log.info("Edited {} {} -> {} {} ({} allocations)", before.getKind(), before.getAmount(),
                after.getKind(), after.getAmount(), applied.getAllocations().size());
        return after;
    }

    /**
     * Allocation rows must match the stored kind: none for LENDING, exactly one
     * full-amount row for incoming money, and rows summing to the amount for
     * everything that draws provenance.
     */
    private void verifyConsistent(Transaction transaction, List<FundingAllocation> allocations) {
        Money total = Money.sum(allocations.stream().map(FundingAllocation::getAmount).toList());
        String problem = null;
        if (transaction.getKind() == TransactionKind.LENDING) {
            if (!allocations.isEmpty()) {
                problem = "LENDING carries " + allocations.size() + " allocation rows";
            }
        } else if (transaction.tagsIncomingFunds()) {
            if (allocations.size() != 1 || !total.equals(transaction.getAmount())) {
                problem = "incoming " + transaction.getKind() + " has " + allocations.size()
                        + " allocation rows totalling " + total;
            }
        } else if (allocations.isEmpty() || !total.equals(transaction.getAmount())) {
            problem = transaction.getKind() + " of " + transaction.getAmount() + " has "
                    + allocations.size() + " allocation rows totalling " + total;
        }
        if (problem != null) {
            InconsistentLedgerException e = new InconsistentLedgerException(
                "Transaction " + transaction.getId() + " is inconsistent: " + problem);
            log.error("Refusing to edit inconsistent transaction {}: {}", transaction.getId(), problem);
            throw e;
        }
    }

    private TransactionIntent constrainPlain(Transaction before, List<FundingAllocation> oldAllocations,
                                             TransactionIntent intent) {
        TransactionKind kind = intent.getKind() != null ? intent.getKind() : before.getKind();
        if (kind.isDebtKind()) {
            throw new ValidationException("Cannot turn a transaction into " + kind);
        }
        if (intent.getDebtId() != null) {
            throw new ValidationException("Debt links are set by the debt subledger only");
        }
        TransactionIntent.TransactionIntentBuilder effective = intent.toBuilder()
            .kind(kind)
            .date(intent.getDate() != null ? intent.getDate() : before.getDate())
            .idempotencyKey(null);
        if (kind == TransactionKind.INCOME && blank(intent.getFundingSourceName())
                && before.getKind() == TransactionKind.INCOME) {
            effective.fundingSourceName(oldAllocations.get(0).getFundingSourceName());
        }
        return effective.build();
    }

    /**
     * Debt transactions keep their kind, accounts and debt link; only amount, date,
     * description and (for outgoing repayments) the funding selection may change.
     */
    private TransactionIntent constrainDebtLinked(Transaction before, List<FundingAllocation> oldAllocations,
                                                  TransactionIntent intent) {
        if (intent.getKind() != null && intent.getKind() != before.getKind()) {
            throw new ValidationException("The kind of a debt transaction cannot change");
        }
        if (changed(intent.getSourceAccountId(), before.getSourceAccountId())
                || changed(intent.getDestinationAccountId(), before.getDestinationAccountId())) {
            throw new ValidationException("The accounts of a debt transaction cannot change");
        }
        if (intent.getDebtId() != null && !intent.getDebtId().equals(before.getDebtId())) {
            throw new ValidationException("The debt link of a transaction cannot change");
        }
        if (intent.getItems() != null && !intent.getItems().isEmpty()) {
            throw new ValidationException("Debt transactions carry no line items");
        }
        return TransactionIntent.builder()
            .kind(before.getKind())
            .amount(intent.getAmount())
            .date(intent.getDate() != null ? intent.getDate() : before.getDate())
            .description(intent.getDescription())
            .categoryName(before.getCategoryName())
            .sourceAccountId(before.getSourceAccountId())
            .destinationAccountId(before.getDestinationAccountId())
            .fundingSourceName(before.tagsIncomingFunds() ? oldAllocations.get(0).getFundingSourceName() : null)
            .fundingSelection(before.drawsProvenance() ? intent.getFundingSelection() : FundingSelection.auto())
            .debtId(before.getDebtId())
            .build();
    }

    private static boolean changed(UUID requested, UUID current) {
        return requested != null && !Objects.equals(requested, current);
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
