package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.account.Account;
import com.flagship.fund_ledger.ledger.allocation.AllocationPlan;
import com.flagship.fund_ledger.ledger.allocation.SourceAmount;
import com.flagship.fund_ledger.ledger.allocation.TagBalance;
import com.flagship.fund_ledger.ledger.allocation.TagBalanceCalculator;
import com.flagship.fund_ledger.ledger.allocation.WaterfallAllocator;
import com.flagship.fund_ledger.ledger.event.TransactionAppliedEvent;
import com.flagship.fund_ledger.ledger.exception.AllocationMismatchException;
import com.flagship.fund_ledger.ledger.exception.ConcurrentBalanceModificationException;
import com.flagship.fund_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.fund_ledger.ledger.exception.LedgerException;
import com.flagship.fund_ledger.ledger.exception.NotFoundException;
import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.ledger.store.AccountRepository;
import com.flagship.fund_ledger.ledger.store.CategoryRepository;
import com.flagship.fund_ledger.ledger.store.FundingAllocationRepository;
import com.flagship.fund_ledger.ledger.store.FundingSourceRepository;
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
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Applies a transaction intent to balances and provenance as one database transaction.
 *
 * Steps, in order:
 * <ol>
 *   <li>validate the intent and load the (owned) accounts it names</li>
 *   <li>resolve the category, and for incoming money the funding source tag</li>
 *   <li>for outgoing money, build the allocation (manual list or waterfall)</li>
 *   <li>write the transaction row, then its allocation rows</li>
 *   <li>apply balance effects: increments unconditionally, decrements only if the
 *       account stays at or above its floor</li>
 *   <li>write line items and the outbox event</li>
 * </ol>
 * Any exception rolls all of it back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionApplyService {

    public static final String INITIAL_BALANCE = "Initial Balance";
    public static final String DEFAULT_INCOME_SOURCE = "Income";

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final FundingAllocationRepository allocationRepository;
    private final FundingSourceRepository fundingSourceRepository;
    private final CategoryRepository categoryRepository;
    private final LineItemRepository lineItemRepository;
    private final TagBalanceCalculator tagBalanceCalculator;
    private final WaterfallAllocator waterfallAllocator;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * Records an INCOME, EXPENSE or TRANSFER. Debt transactions go through the debt
     * subledger instead.
     */
    @Transactional
    public Transaction createTransaction(UUID ownerId, TransactionIntent intent) {
        requireOwner(ownerId);
        if (intent == null) {
            throw new ValidationException("Transaction intent is required");
        }
        if (intent.getKind() != null && intent.getKind().isDebtKind()) {
            throw new ValidationException(intent.getKind() + " transactions are recorded through debts");
        }
        if (intent.getDebtId() != null) {
            throw new ValidationException("Debt links are set by the debt subledger only");
        }
        return metrics.time("create_transaction", () -> applyNew(ownerId, intent));
    }

    /**
     * Records a transaction on behalf of the debt subledger, inside its unit of work.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AppliedTransaction applyDebtTransaction(UUID ownerId, TransactionIntent intent) {
        requireOwner(ownerId);
        if (intent.getDebtId() == null) {
            throw new ValidationException(intent.getKind() + " must be linked to a debt");
        }
        return applyAndPublish(ownerId, intent);
    }

    /**
     * Books the opening balance of a freshly inserted account.
     *
     * Positive amounts become an INCOME tagged {@value #INITIAL_BALANCE}. Negative
     * amounts (CREDIT accounts only) become an EXPENSE with a single allocation to that
     * same source; the account was just created at zero, so the decrement is applied
     * without the floor check.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Transaction recordOpeningBalance(UUID ownerId, Account account, Money openingBalance) {
        if (openingBalance.isPositive()) {
            TransactionIntent intent = TransactionIntent.builder()
                .kind(TransactionKind.INCOME)
                .amount(openingBalance)
                .description(INITIAL_BALANCE)
                .destinationAccountId(account.getId())
                .fundingSourceName(INITIAL_BALANCE)
                .build();
            return applyAndPublish(ownerId, intent).getTransaction();
        }

        if (!account.getKind().isCredit()) {
            throw new ValidationException("Only CREDIT accounts may open with a negative balance");
        }
        Money owed = openingBalance.negate();
        FundingSource source = fundingSourceRepository.resolveOrCreate(ownerId, INITIAL_BALANCE, FundingSource.Category.OTHER);
        Transaction transaction = new Transaction(UUID.randomUUID(), ownerId, TransactionKind.EXPENSE, owed,
                today(), INITIAL_BALANCE, null, null, account.getId(), null, null, null, null, null);
        transactionRepository.insert(transaction);
        List<SourceAmount> allocation = List.of(new SourceAmount(source.getId(), source.getName(), owed));
        allocationRepository.insertAll(transaction.getId(), allocation);
        accountRepository.adjustBalance(account.getId(), openingBalance);

        AppliedTransaction applied = reload(ownerId, transaction.getId(), allocation);
        outboxService.record(TransactionAppliedEvent.from(applied.getTransaction(), applied.getAllocations()));
        metrics.recordTransactionApplied(TransactionKind.EXPENSE.name());
        log.info("Opening balance {} booked as owed amount on account {}", openingBalance, account.getId());
        return applied.getTransaction();
    }

    /**
     * Validation, allocation and persistence shared by creation and edit.
     *
     * @param transactionId id of the row to write
     * @param existing the row being rewritten in place, or null to insert a new one;
     *        its old effects must already have been undone
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AppliedTransaction apply(UUID ownerId, UUID transactionId, TransactionIntent intent, Transaction existing) {
        requireOwner(ownerId);
        validate(intent);

        TransactionKind kind = intent.getKind();
        Money amount = intent.getAmount();
        Map<UUID, Account> locked = lockAccounts(ownerId, intent.getSourceAccountId(), intent.getDestinationAccountId());
        Account source = intent.getSourceAccountId() != null ? locked.get(intent.getSourceAccountId()) : null;
        Account destination = intent.getDestinationAccountId() != null
                ? locked.get(intent.getDestinationAccountId()) : null;

        UUID categoryId = categoryRepository.resolveOrCreate(ownerId, intent.getCategoryName(), kind);

        List<SourceAmount> allocations;
        if (kind == TransactionKind.INCOME || (kind == TransactionKind.REPAYMENT && destination != null)) {
            allocations = List.of(tagIncoming(ownerId, intent));
        } else if (kind == TransactionKind.LENDING) {
            allocations = List.of();
        } else {
            // the source row lock taken above keeps these tag balances current until commit
            allocations = allocateOutgoing(ownerId, source.getId(), amount, intent.getFundingSelection());
        }

        if (source != null && source.spendable().isLessThan(amount)) {
            throw new InsufficientFundsException(amount, source.spendable());
        }

        Transaction row = new Transaction(
            transactionId,
            ownerId,
            kind,
            amount,
            intent.getDate() != null ? intent.getDate() : today(),
            trimToNull(intent.getDescription()),
            categoryId,
            null,
            intent.getSourceAccountId(),
            intent.getDestinationAccountId(),
            intent.getDebtId(),
            existing != null ? existing.getIdempotencyKey() : trimToNull(intent.getIdempotencyKey()),
            null,
            null
        );
        if (existing == null) {
            transactionRepository.insert(row);
        } else {
            transactionRepository.update(row);
        }

        if (!allocations.isEmpty()) {
            allocationRepository.insertAll(transactionId, allocations);
        }

        for (BalanceEffect effect : BalanceEffect.of(amount, intent.getSourceAccountId(), intent.getDestinationAccountId())) {
            if (effect.isDecrement()) {
                Money floor = source.balanceFloor();
                if (!accountRepository.decrementIfCovered(effect.getAccountId(), amount, floor)) {
                    throw new ConcurrentBalanceModificationException(effect.getAccountId());
                }
            } else if (!accountRepository.incrementWithinRange(effect.getAccountId(), amount)) {
                throw new ValidationException("Balance of account " + effect.getAccountId() + " would exceed "
                        + Money.MAX_INTEGER_DIGITS + " integer digits");
            }
        }

        if (kind == TransactionKind.EXPENSE && !intent.getItems().isEmpty()) {
            List<UUID> itemCategories = intent.getItems().stream()
                .map(item -> categoryRepository.resolveOrCreate(ownerId, item.getCategoryName(), TransactionKind.EXPENSE))
                .toList();
            lineItemRepository.insertAll(transactionId, intent.getItems(), itemCategories);
        }

        return reload(ownerId, transactionId, allocations);
    }

    private Transaction applyNew(UUID ownerId, TransactionIntent intent) {
        return applyAndPublish(ownerId, intent).getTransaction();
    }

    private AppliedTransaction applyAndPublish(UUID ownerId, TransactionIntent intent) {
        UUID transactionId = UUID.randomUUID();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());
        try {
            AppliedTransaction applied = apply(ownerId, transactionId, intent, null);
            Transaction transaction = applied.getTransaction();
            outboxService.record(TransactionAppliedEvent.from(transaction, applied.getAllocations()));
            metrics.recordTransactionApplied(transaction.getKind().name());
            log.info("Applied {} of {} (source={}, destination={}, allocations={})",
                    transaction.getKind(), transaction.getAmount(), transaction.getSourceAccountId(),
                    transaction.getDestinationAccountId(), applied.getAllocations().size());
            return applied;
        } catch (LedgerException e) {
            metrics.recordRejected("apply", e.getErrorCode());
            log.warn("Rejected {} intent: {}", intent.getKind(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private SourceAmount tagIncoming(UUID ownerId, TransactionIntent intent) {
        String name = trimToNull(intent.getFundingSourceName());
        if (name == null) {
            if (intent.getKind() != TransactionKind.INCOME) {
                throw new ValidationException("Incoming " + intent.getKind() + " requires a funding source name");
            }
            name = DEFAULT_INCOME_SOURCE;
        }
        FundingSource.Category category = intent.getKind() == TransactionKind.INCOME && intent.getDebtId() == null
                ? FundingSource.Category.INCOME : FundingSource.Category.OTHER;
        FundingSource source = fundingSourceRepository.resolveOrCreate(ownerId, name, category);
        return new SourceAmount(source.getId(), source.getName(), intent.getAmount());
    }

    private List<SourceAmount> allocateOutgoing(UUID ownerId, UUID accountId, Money amount, FundingSelection selection) {
        List<TagBalance> balances = tagBalanceCalculator.computeTagBalances(ownerId, accountId);
        if (selection instanceof FundingSelection.Manual manual) {
            return validateManual(ownerId, manual.getAllocations(), amount, balances);
        }
        AllocationPlan plan = waterfallAllocator.allocate(balances, amount, false);
        log.debug("Waterfall drew {} from {} sources of account {}", plan.getTotalAllocated(),
                plan.getAllocations().size(), accountId);
        return plan.getAllocations();
    }

    /**
     * A manual list must be non-empty, name each owned source once, use positive
     * amounts that the source actually holds in the account, and add up to exactly
     * the transaction amount.
     */
    private List<SourceAmount> validateManual(UUID ownerId, List<ManualAllocation> manual, Money amount,
                                              List<TagBalance> balances) {
        if (manual == null || manual.isEmpty()) {
            throw new ValidationException("Manual allocation requires at least one entry");
        }
        Set<UUID> seen = new HashSet<>();
        for (ManualAllocation entry : manual) {
            if (entry.getFundingSourceId() == null) {
                throw new ValidationException("Manual allocation entry without funding source");
            }
            if (entry.getAmount() == null || !entry.getAmount().isPositive()) {
                throw new ValidationException("Manual allocation amounts must be positive");
            }
            if (!seen.add(entry.getFundingSourceId())) {
                throw new ValidationException("Funding source listed twice: " + entry.getFundingSourceId());
            }
        }

        Money total = Money.sum(manual.stream().map(ManualAllocation::getAmount).toList());
        if (!total.equals(amount)) {
            throw new AllocationMismatchException(total, amount);
        }

        Map<UUID, FundingSource> sources = fundingSourceRepository.findByIds(ownerId, seen);
        Map<UUID, Money> held = balances.stream()
            .collect(Collectors.toMap(TagBalance::getFundingSourceId, TagBalance::getBalance));

        List<SourceAmount> allocations = new ArrayList<>(manual.size());
        for (ManualAllocation entry : manual) {
            FundingSource source = sources.get(entry.getFundingSourceId());
            if (source == null) {
                throw new NotFoundException("FundingSource", entry.getFundingSourceId());
            }
            Money available = held.getOrDefault(source.getId(), Money.ZERO);
            if (entry.getAmount().isGreaterThan(available)) {
                throw new InsufficientFundsException(entry.getAmount(), available);
            }
            allocations.add(new SourceAmount(source.getId(), source.getName(), entry.getAmount()));
        }
        return allocations;
    }

    private void validate(TransactionIntent intent) {
        if (intent.getKind() == null) {
            throw new ValidationException("Transaction kind is required");
        }
        if (intent.getAmount() == null || !intent.getAmount().isPositive()) {
            throw new ValidationException("Amount must be positive");
        }
        if (!intent.getAmount().isStorable()) {
            throw new ValidationException("Amount must have at most " + Money.MAX_INTEGER_DIGITS + " integer digits");
        }
        intent.getKind().validateAccounts(intent.getSourceAccountId(), intent.getDestinationAccountId());
        if (intent.getFundingSelection() instanceof FundingSelection.Manual
                && (intent.getSourceAccountId() == null || intent.getKind() == TransactionKind.LENDING)) {
            throw new ValidationException("Manual allocation only applies to money leaving an account with provenance");
        }
        List<LineItem> items = intent.getItems() != null ? intent.getItems() : List.of();
        if (!items.isEmpty() && intent.getKind() != TransactionKind.EXPENSE) {
            throw new ValidationException("Line items are only allowed on EXPENSE");
        }
        for (LineItem item : items) {
            if (item.getName() == null || item.getName().isBlank()) {
                throw new ValidationException("Line item name is required");
            }
            if (item.getUnitPrice() == null || item.getUnitPrice().isNegative()) {
                throw new ValidationException("Line item price must not be negative");
            }
            if (item.getQuantity() <= 0) {
                throw new ValidationException("Line item quantity must be positive");
            }
        }
    }

    /**
     * Row-locks the named accounts, always in id order. Tag balances of the source are
     * only read while its lock is held.
     */
    private Map<UUID, Account> lockAccounts(UUID ownerId, UUID sourceAccountId, UUID destinationAccountId) {
        Map<UUID, Account> locked = new TreeMap<>();
        if (sourceAccountId != null) {
            locked.put(sourceAccountId, null);
        }
        if (destinationAccountId != null) {
            locked.put(destinationAccountId, null);
        }
        for (UUID accountId : List.copyOf(locked.keySet())) {
            Account account = accountRepository.findByIdForUpdate(ownerId, accountId)
                .orElseThrow(() -> new NotFoundException("Account", accountId));
            locked.put(accountId, account);
        }
        return locked;
    }

    private AppliedTransaction reload(UUID ownerId, UUID transactionId, List<SourceAmount> allocations) {
        Transaction stored = transactionRepository.findById(ownerId, transactionId)
            .orElseThrow(() -> new IllegalStateException("Transaction vanished after write: " + transactionId));
        List<FundingAllocation> rows = allocations.stream()
            .map(a -> new FundingAllocation(transactionId, a.getFundingSourceId(), a.getFundingSourceName(), a.getAmount()))
            .toList();
        return new AppliedTransaction(stored, rows);
    }

    private LocalDate today() {
        return LocalDate.now();
    }

    static void requireOwner(UUID ownerId) {
        if (ownerId == null) {
            throw new ValidationException("A verified owner id is required");
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
