package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.debt.event.DebtDeletedEvent;
import com.flagship.fund_ledger.debt.event.DebtOpenedEvent;
import com.flagship.fund_ledger.debt.event.DebtPaymentRecordedEvent;
import com.flagship.fund_ledger.debt.event.DebtRevisedEvent;
import com.flagship.fund_ledger.debt.event.DebtSettledEvent;
import com.flagship.fund_ledger.ledger.AppliedTransaction;
import com.flagship.fund_ledger.ledger.Transaction;
import com.flagship.fund_ledger.ledger.TransactionApplyService;
import com.flagship.fund_ledger.ledger.TransactionIntent;
import com.flagship.fund_ledger.ledger.TransactionKind;
import com.flagship.fund_ledger.ledger.exception.LedgerException;
import com.flagship.fund_ledger.ledger.exception.NotFoundException;
import com.flagship.fund_ledger.ledger.exception.ValidationException;
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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Debt subledger: lending and borrowing on top of the transaction engine.
 *
 * Every money movement is an ordinary ledger transaction linked to the debt by id,
 * so balances and provenance follow the same rules as everywhere else:
 * <ul>
 *   <li>LENDING opens with a LENDING transaction out of the account (no provenance drawn)</li>
 *   <li>BORROWING opens with an INCOME tagged {@code Loan: <contact>}</li>
 *   <li>a LENDING payment is a REPAYMENT into the account tagged {@code Repayment: <contact>}</li>
 *   <li>a BORROWING payment is a REPAYMENT out of the account, allocated by the waterfall</li>
 * </ul>
 * Each operation is one database transaction covering the debt row, the linked
 * transaction and the outbox event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DebtService {

    static final String LOAN_SOURCE_PREFIX = "Loan: ";
    static final String REPAYMENT_SOURCE_PREFIX = "Repayment: ";

    private final DebtRepository debtRepository;
    private final ContactRepository contactRepository;
    private final TransactionApplyService applyService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    @Transactional
    public DebtPayment createDebt(UUID ownerId, DebtIntent intent) {
        requireOwner(ownerId);
        if (intent.getAccountId() == null) {
            throw new ValidationException("Account is required to open a debt");
        }
        Contact contact = resolveContact(ownerId, intent.getContactId(), intent.getContactName());
        Debt debt = Debt.open(ownerId, intent.getDirection(), intent.getAmount(), contact.getId(),
                contact.getName(), trimToNull(intent.getDescription()), intent.getDueDate());

        return withDebtContext(debt.getId(), "create_debt", () -> {
            debtRepository.saveAndFlush(DebtEntity.fromDomain(debt));

            TransactionIntent.TransactionIntentBuilder disbursement = TransactionIntent.builder()
                .amount(debt.getAmount())
                .date(intent.getDate())
                .debtId(debt.getId());
            if (debt.getDirection() == DebtDirection.LENDING) {
                disbursement.kind(TransactionKind.LENDING)
                    .sourceAccountId(intent.getAccountId())
                    .description(describe(debt, "Loan to " + contact.getName()));
            } else {
                disbursement.kind(TransactionKind.INCOME)
                    .destinationAccountId(intent.getAccountId())
                    .fundingSourceName(LOAN_SOURCE_PREFIX + contact.getName())
                    .description(describe(debt, "Loan from " + contact.getName()));
            }
            Transaction transaction = applyService.applyDebtTransaction(ownerId, disbursement.build()).getTransaction();

            Debt stored = reload(ownerId, debt.getId());
            outboxService.record(DebtOpenedEvent.from(stored, transaction.getId()));
            metrics.recordDebtOpened(stored.getDirection().name());
            log.info("Opened {} debt of {} with {}", stored.getDirection(), stored.getAmount(), contact.getName());
            return new DebtPayment(stored, transaction);
        });
    }

    /**
     * Pays {@code amount} off the debt through {@code accountId}.
     *
     * @throws ValidationException if the debt is already paid or the amount exceeds
     *         the remaining balance; nothing is written in that case
     */
    @Transactional
    public DebtPayment recordDebtPayment(UUID ownerId, UUID debtId, Money amount, UUID accountId, String description) {
        requireOwner(ownerId);
        return withDebtContext(debtId, "debt_payment", () -> {
            DebtEntity entity = lockDebt(ownerId, debtId);
            return pay(ownerId, entity, amount, accountId, description);
        });
    }

    /**
     * Settles the debt. With an account the full remaining amount is paid through it;
     * without one the debt is closed administratively and no balance moves.
     */
    @Transactional
    public DebtPayment markDebtPaid(UUID ownerId, UUID debtId, UUID accountId) {
        requireOwner(ownerId);
        return withDebtContext(debtId, "debt_settle", () -> {
            DebtEntity entity = lockDebt(ownerId, debtId);
            Debt current = toDomain(entity);
            if (accountId != null) {
                return pay(ownerId, entity, current.getRemaining(), accountId, null);
            }
            Debt settled = current.settle();
            entity.updateFromDomain(settled);
            debtRepository.saveAndFlush(entity);
            outboxService.record(DebtSettledEvent.from(settled, null));
            metrics.recordDebtSettled(settled.getDirection().name());
            log.info("Debt settled administratively, {} written off", current.getRemaining());
            return new DebtPayment(reload(ownerId, debtId), null);
        });
    }

    @Transactional
    public Debt editDebt(UUID ownerId, UUID debtId, DebtRevision revision) {
        requireOwner(ownerId);
        return withDebtContext(debtId, "debt_edit", () -> {
            DebtEntity entity = lockDebt(ownerId, debtId);
            Contact contact = revision.getContactId() != null || trimToNull(revision.getContactName()) != null
                    ? resolveContact(ownerId, revision.getContactId(), revision.getContactName())
                    : null;
            Debt revised = toDomain(entity).revise(
                revision.getAmount(),
                contact != null ? contact.getId() : null,
                contact != null ? contact.getName() : null,
                trimToNull(revision.getDescription()),
                revision.getDueDate());
            entity.updateFromDomain(revised);
            debtRepository.saveAndFlush(entity);
            outboxService.record(DebtRevisedEvent.from(revised, "edit"));
            log.info("Debt revised: amount={}, remaining={}", revised.getAmount(), revised.getRemaining());
            return reload(ownerId, debtId);
        });
    }

    /**
     * Removes the debt. Its transactions keep their balance effects and lose the link.
     */
    @Transactional
    public void deleteDebt(UUID ownerId, UUID debtId) {
        requireOwner(ownerId);
        withDebtContext(debtId, "debt_delete", () -> {
            DebtEntity entity = lockDebt(ownerId, debtId);
            Debt debt = toDomain(entity);
            debtRepository.delete(entity);
            debtRepository.flush();
            outboxService.record(DebtDeletedEvent.from(debt));
            log.info("Deleted {} debt with {} remaining", debt.getDirection(), debt.getRemaining());
            return debt;
        });
    }

    /**
     * Keeps a debt in step with an edit of one of its linked transactions.
     *
     * A REPAYMENT moves remaining by {@code -(new - old)}; the disbursement (LENDING,
     * or the INCOME of a BORROWING) moves amount and remaining by {@code new - old}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyLinkedTransactionEdit(UUID ownerId, Transaction before, Transaction after) {
        if (before.getDebtId() == null || before.getAmount().equals(after.getAmount())) {
            return;
        }
        DebtEntity entity = debtRepository.findForUpdate(before.getDebtId(), ownerId).orElse(null);
        if (entity == null) {
            log.debug("Debt {} no longer exists, nothing to adjust", before.getDebtId());
            return;
        }
        Debt current = toDomain(entity);
        boolean repayment = before.getKind() == TransactionKind.REPAYMENT;
        Debt revised = repayment
                ? current.revisePayment(before.getAmount(), after.getAmount())
                : current.revisePrincipal(before.getAmount(), after.getAmount());
        entity.updateFromDomain(revised);
        debtRepository.saveAndFlush(entity);
        outboxService.record(DebtRevisedEvent.from(revised, repayment ? "payment_edited" : "principal_edited"));
        log.info("Debt {} follows edited {}: amount={}, remaining={}", revised.getId(), before.getKind(),
                revised.getAmount(), revised.getRemaining());
    }

    @Transactional(readOnly = true)
    public Debt getDebt(UUID ownerId, UUID debtId) {
        requireOwner(ownerId);
        return reload(ownerId, debtId);
    }

    @Transactional(readOnly = true)
    public List<Debt> listDebts(UUID ownerId, boolean includePaid) {
        requireOwner(ownerId);
        List<DebtEntity> entities = includePaid
                ? debtRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId)
                : debtRepository.findByOwnerIdAndPaidFalseOrderByCreatedAtDesc(ownerId);
        Map<UUID, String> names = contactNames(ownerId, entities);
        return entities.stream()
            .map(entity -> entity.toDomain(names.get(entity.getContactId())))
            .toList();
    }

    @Transactional(readOnly = true)
    public DebtSummary getDebtSummary(UUID ownerId) {
        requireOwner(ownerId);
        List<DebtEntity> active = debtRepository.findByOwnerIdAndPaidFalseOrderByCreatedAtDesc(ownerId);
        List<Money> lent = remainingOf(active, DebtDirection.LENDING);
        List<Money> borrowed = remainingOf(active, DebtDirection.BORROWING);
        return new DebtSummary(Money.sum(lent), Money.sum(borrowed), lent.size(), borrowed.size());
    }

    @Transactional(readOnly = true)
    public List<Contact> listContacts(UUID ownerId) {
        requireOwner(ownerId);
        return contactRepository.findAllByOwner(ownerId).stream()
            .map(ContactEntity::toDomain)
            .toList();
    }

    /**
     * @throws ValidationException if the owner already has a contact with that name
     */
    @Transactional
    public Contact createContact(UUID ownerId, String name) {
        requireOwner(ownerId);
        String trimmed = requireName(name);
        if (contactRepository.insertIfAbsent(UUID.randomUUID(), ownerId, trimmed) == 0) {
            throw new ValidationException("Contact '" + trimmed + "' already exists");
        }
        log.info("Created contact '{}'", trimmed);
        return findContactByName(ownerId, trimmed);
    }

    private DebtPayment pay(UUID ownerId, DebtEntity entity, Money amount, UUID accountId, String description) {
        if (accountId == null) {
            throw new ValidationException("Account is required to record a payment");
        }
        Debt current = toDomain(entity);
        Debt paid = current.recordPayment(amount);

        TransactionIntent.TransactionIntentBuilder repayment = TransactionIntent.builder()
            .kind(TransactionKind.REPAYMENT)
            .amount(amount)
            .debtId(current.getId());
        if (current.getDirection() == DebtDirection.LENDING) {
            repayment.destinationAccountId(accountId)
                .fundingSourceName(REPAYMENT_SOURCE_PREFIX + current.getContactName())
                .description(description != null ? description : "Repayment from " + current.getContactName());
        } else {
            repayment.sourceAccountId(accountId)
                .description(description != null ? description : "Repayment to " + current.getContactName());
        }
        AppliedTransaction applied = applyService.applyDebtTransaction(ownerId, repayment.build());

        entity.updateFromDomain(paid);
        debtRepository.saveAndFlush(entity);
        Transaction transaction = applied.getTransaction();
        outboxService.record(DebtPaymentRecordedEvent.from(paid, transaction.getId(), amount.toBigDecimal()));
        metrics.recordDebtPayment(paid.getDirection().name());
        if (paid.isPaid()) {
            outboxService.record(DebtSettledEvent.from(paid, transaction.getId()));
            metrics.recordDebtSettled(paid.getDirection().name());
        }
        log.info("Recorded payment of {} on {} debt, remaining {}", amount, paid.getDirection(), paid.getRemaining());
        return new DebtPayment(reload(ownerId, paid.getId()), transaction);
    }

    private Contact resolveContact(UUID ownerId, UUID contactId, String contactName) {
        if (contactId != null) {
            return contactRepository.findByIdAndOwnerId(contactId, ownerId)
                .map(ContactEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("Contact", contactId));
        }
        String trimmed = requireName(contactName);
        if (contactRepository.insertIfAbsent(UUID.randomUUID(), ownerId, trimmed) == 1) {
            log.debug("Created contact '{}' on the fly", trimmed);
        }
        return findContactByName(ownerId, trimmed);
    }

    private Contact findContactByName(UUID ownerId, String name) {
        return contactRepository.findByOwnerIdAndName(ownerId, name)
            .map(ContactEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException("Contact '" + name + "' missing after insert"));
    }

    private DebtEntity lockDebt(UUID ownerId, UUID debtId) {
        return debtRepository.findForUpdate(debtId, ownerId)
            .orElseThrow(() -> new NotFoundException("Debt", debtId));
    }

    private Debt reload(UUID ownerId, UUID debtId) {
        DebtEntity entity = debtRepository.findByIdAndOwnerId(debtId, ownerId)
            .orElseThrow(() -> new NotFoundException("Debt", debtId));
        return toDomain(entity);
    }

    private Debt toDomain(DebtEntity entity) {
        String name = contactRepository.findById(entity.getContactId())
            .map(ContactEntity::getName)
            .orElse(null);
        return entity.toDomain(name);
    }

    private Map<UUID, String> contactNames(UUID ownerId, List<DebtEntity> entities) {
        Set<UUID> ids = entities.stream().map(DebtEntity::getContactId).collect(Collectors.toSet());
        if (ids.isEmpty()) {
            return Map.of();
        }
        return contactRepository.findByOwnerIdAndIdIn(ownerId, ids).stream()
            .collect(Collectors.toMap(ContactEntity::getId, ContactEntity::getName));
    }

    private static List<Money> remainingOf(List<DebtEntity> debts, DebtDirection direction) {
        return debts.stream()
            .filter(d -> d.getDirection() == direction)
            .map(d -> Money.of(d.getRemaining()))
            .toList();
    }

    private <T> T withDebtContext(UUID debtId, String operation, Supplier<T> work) {
        MDC.put(CorrelationContext.DEBT_ID_MDC_KEY, debtId.toString());
        try {
            return metrics.time(operation, work);
        } catch (LedgerException e) {
            metrics.recordRejected(operation, e.getErrorCode());
            log.warn("Rejected {}: {}", operation, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.DEBT_ID_MDC_KEY);
        }
    }

    private static String describe(Debt debt, String fallback) {
        return debt.getDescription() != null ? debt.getDescription() : fallback;
    }

    private static void requireOwner(UUID ownerId) {
        if (ownerId == null) {
            throw new ValidationException("A verified owner id is required");
        }
    }

    private static String requireName(String name) {
        String trimmed = trimToNull(name);
        if (trimmed == null) {
            throw new ValidationException("Contact name is required");
        }
        if (trimmed.length() > 100) {
            throw new ValidationException("Contact name must be at most 100 characters");
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
