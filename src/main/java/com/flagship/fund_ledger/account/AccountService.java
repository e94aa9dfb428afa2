package com.flagship.fund_ledger.account;

import com.flagship.fund_ledger.ledger.TransactionApplyService;
import com.flagship.fund_ledger.ledger.allocation.TagBalance;
import com.flagship.fund_ledger.ledger.allocation.TagBalanceCalculator;
import com.flagship.fund_ledger.ledger.exception.NotFoundException;
import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.ledger.store.AccountRepository;
import com.flagship.fund_ledger.ledger.store.TransactionRepository;
import com.flagship.fund_ledger.money.Money;
import com.flagship.fund_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Opening and reading accounts.
 *
 * An account starts at zero; a non-zero opening balance is booked as a transaction
 * so the balance still equals the sum of transaction effects.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final TransactionApplyService applyService;
    private final TagBalanceCalculator tagBalanceCalculator;

    @Transactional
    public Account createAccount(UUID ownerId, AccountDraft draft) {
        requireOwner(ownerId);
        validate(draft);

        boolean credit = draft.getKind().isCredit();
        Account account = new Account(
            UUID.randomUUID(),
            ownerId,
            draft.getName().trim(),
            draft.getKind(),
            Money.ZERO,
            credit ? draft.getCreditLimit() : null,
            credit ? draft.getStatementDay() : null,
            credit ? draft.getDueDay() : null,
            null,
            null
        );

        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, account.getId().toString());
        try {
            accountRepository.insert(account);
            Money opening = draft.getOpeningBalance();
            if (opening != null && !opening.isZero()) {
                applyService.recordOpeningBalance(ownerId, account, opening);
            }
            log.info("Opened {} account '{}' with balance {}", account.getKind(), account.getName(),
                    opening != null ? opening : Money.ZERO);
            return loadAccount(ownerId, account.getId());
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(UUID ownerId) {
        requireOwner(ownerId);
        return accountRepository.findAllByOwner(ownerId);
    }

    /**
     * The account with its INCOME and EXPENSE totals and transaction count.
     */
    @Transactional(readOnly = true)
    public AccountDetail getAccountDetail(UUID ownerId, UUID accountId) {
        requireOwner(ownerId);
        Account account = loadAccount(ownerId, accountId);
        return new AccountDetail(account, transactionRepository.summarizeActivity(ownerId, accountId));
    }

    @Transactional(readOnly = true)
    public List<TagBalance> getTagBalances(UUID ownerId, UUID accountId) {
        requireOwner(ownerId);
        loadAccount(ownerId, accountId);
        return tagBalanceCalculator.computeTagBalances(ownerId, accountId);
    }

    private void validate(AccountDraft draft) {
        if (draft == null || draft.getName() == null || draft.getName().isBlank()) {
            throw new ValidationException("Account name is required");
        }
        if (draft.getName().trim().length() > 100) {
            throw new ValidationException("Account name must be at most 100 characters");
        }
        if (draft.getKind() == null) {
            throw new ValidationException("Account kind is required");
        }
        Money opening = draft.getOpeningBalance();
        if (opening != null && opening.isNegative() && !draft.getKind().isCredit()) {
            throw new ValidationException("Only CREDIT accounts may open with a negative balance");
        }
        if (!draft.getKind().isCredit()) {
            return;
        }
        if (draft.getCreditLimit() != null && draft.getCreditLimit().isNegative()) {
            throw new ValidationException("Credit limit must not be negative");
        }
        checkDay("Statement day", draft.getStatementDay());
        checkDay("Due day", draft.getDueDay());
    }

    private static void checkDay(String field, Integer day) {
        if (day != null && (day < 1 || day > 31)) {
            throw new ValidationException(field + " must be between 1 and 31");
        }
    }

    private Account loadAccount(UUID ownerId, UUID accountId) {
        return accountRepository.findById(ownerId, accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));
    }

    private static void requireOwner(UUID ownerId) {
        if (ownerId == null) {
            throw new ValidationException("A verified owner id is required");
        }
    }
}
