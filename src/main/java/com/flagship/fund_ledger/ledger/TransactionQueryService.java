package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.ledger.exception.NotFoundException;
import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.ledger.store.AccountRepository;
import com.flagship.fund_ledger.ledger.store.FundingAllocationRepository;
import com.flagship.fund_ledger.ledger.store.FundingSourceRepository;
import com.flagship.fund_ledger.ledger.store.LineItemRepository;
import com.flagship.fund_ledger.ledger.store.TransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of the ledger. Every lookup is owner scoped.
 */
@Service
@RequiredArgsConstructor
public class TransactionQueryService {

    private final TransactionRepository transactionRepository;
    private final FundingAllocationRepository allocationRepository;
    private final LineItemRepository lineItemRepository;
    private final FundingSourceRepository fundingSourceRepository;
    private final AccountRepository accountRepository;

    @Transactional(readOnly = true)
    public TransactionDetail getTransaction(UUID ownerId, UUID transactionId) {
        TransactionApplyService.requireOwner(ownerId);
        Transaction transaction = transactionRepository.findById(ownerId, transactionId)
            .orElseThrow(() -> new NotFoundException("Transaction", transactionId));
        return new TransactionDetail(
            transaction,
            allocationRepository.findByTransactionId(transactionId),
            lineItemRepository.findByTransactionId(transactionId)
        );
    }

    /**
     * Newest first by date then creation time. Entries carry allocations but not
     * line items.
     *
     * @param limit maximum entries, 0 for all
     */
    @Transactional(readOnly = true)
    public List<TransactionDetail> getTransactionHistory(UUID ownerId, UUID accountId, int limit) {
        TransactionApplyService.requireOwner(ownerId);
        if (limit < 0) {
            throw new ValidationException("Limit must not be negative");
        }
        accountRepository.findById(ownerId, accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));
        return withAllocations(transactionRepository.findHistory(ownerId, accountId, limit));
    }

    /**
     * Transactions linked to a debt, oldest first.
     */
    @Transactional(readOnly = true)
    public List<TransactionDetail> getDebtTransactions(UUID ownerId, UUID debtId) {
        TransactionApplyService.requireOwner(ownerId);
        return withAllocations(transactionRepository.findByDebtId(ownerId, debtId));
    }

    @Transactional(readOnly = true)
    public List<FundingSource> listFundingSources(UUID ownerId) {
        TransactionApplyService.requireOwner(ownerId);
        return fundingSourceRepository.findAllByOwner(ownerId);
    }

    private List<TransactionDetail> withAllocations(List<Transaction> transactions) {
        Map<UUID, List<FundingAllocation>> allocations =
            allocationRepository.findByTransactionIds(transactions.stream().map(Transaction::getId).toList());
        return transactions.stream()
            .map(t -> new TransactionDetail(t, allocations.getOrDefault(t.getId(), List.of()), List.of()))
            .toList();
    }
}
