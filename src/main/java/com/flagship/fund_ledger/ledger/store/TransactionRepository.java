package com.flagship.fund_ledger.ledger.store;

import com.flagship.fund_ledger.ledger.Transaction;
import com.flagship.fund_ledger.ledger.TransactionKind;
import com.flagship.fund_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transaction rows. Every read is scoped to the owner.
 */
@Repository
@RequiredArgsConstructor
public class TransactionRepository {

    private static final String SELECT_TRANSACTION =
        "SELECT t.id, t.owner_id, t.kind, t.amount, t.transaction_date, t.description, t.category_id, " +
        "       c.name AS category_name, t.source_account_id, t.destination_account_id, t.debt_id, " +
        "       t.idempotency_key, t.created_at, t.updated_at " +
        "FROM transactions t LEFT JOIN categories c ON c.id = t.category_id ";

    private final JdbcTemplate jdbcTemplate;

    public void insert(Transaction transaction) {
        jdbcTemplate.update(
            "INSERT INTO transactions (id, owner_id, kind, amount, transaction_date, description, category_id, " +
            "source_account_id, destination_account_id, debt_id, idempotency_key) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            transaction.getId(),
            transaction.getOwnerId(),
            transaction.getKind().name(),
            transaction.getAmount().toBigDecimal(),
            transaction.getDate(),
            transaction.getDescription(),
            transaction.getCategoryId(),
            transaction.getSourceAccountId(),
            transaction.getDestinationAccountId(),
            transaction.getDebtId(),
            transaction.getIdempotencyKey()
        );
    }

    /**
     * Rewrites an existing row in place. Identity, owner, idempotency key and
     * creation time are kept.
     */
    public void update(Transaction transaction) {
        int updated = jdbcTemplate.update(
            "UPDATE transactions SET kind = ?, amount = ?, transaction_date = ?, description = ?, " +
            "category_id = ?, source_account_id = ?, destination_account_id = ?, debt_id = ?, " +
            "updated_at = clock_timestamp() " +
            "WHERE id = ? AND owner_id = ?",
            transaction.getKind().name(),
            transaction.getAmount().toBigDecimal(),
            transaction.getDate(),
            transaction.getDescription(),
            transaction.getCategoryId(),
            transaction.getSourceAccountId(),
            transaction.getDestinationAccountId(),
            transaction.getDebtId(),
            transaction.getId(),
            transaction.getOwnerId()
        );
        if (updated != 1) {
            throw new IllegalStateException("Transaction update matched " + updated + " rows: " + transaction.getId());
        }
    }

    public Optional<Transaction> findById(UUID ownerId, UUID transactionId) {
        return jdbcTemplate.query(
            SELECT_TRANSACTION + "WHERE t.id = ? AND t.owner_id = ?",
            transactionRowMapper(),
            transactionId,
            ownerId
        ).stream().findFirst();
    }

    /**
     * Same as {@link #findById} but holds a row lock until the surrounding
     * transaction ends, so two edits of one transaction serialize.
     */
    public Optional<Transaction> findByIdForUpdate(UUID ownerId, UUID transactionId) {
        return jdbcTemplate.query(
            SELECT_TRANSACTION + "WHERE t.id = ? AND t.owner_id = ? FOR UPDATE OF t",
            transactionRowMapper(),
            transactionId,
            ownerId
        ).stream().findFirst();
    }

    public Optional<UUID> findIdByIdempotencyKey(UUID ownerId, String idempotencyKey) {
        return jdbcTemplate.query(
            "SELECT id FROM transactions WHERE owner_id = ? AND idempotency_key = ?",
            (rs, rowNum) -> Rows.uuid(rs, "id"),
            ownerId,
            idempotencyKey
        ).stream().findFirst();
    }

    /**
     * Transactions touching the account, newest first by date then creation time.
     *
     * @param limit maximum rows, 0 for all
     */
    public List<Transaction> findHistory(UUID ownerId, UUID accountId, int limit) {
        String sql = SELECT_TRANSACTION +
            "WHERE t.owner_id = ? AND (t.source_account_id = ? OR t.destination_account_id = ?) " +
            "ORDER BY t.transaction_date DESC, t.created_at DESC, t.id";
        if (limit > 0) {
            return jdbcTemplate.query(sql + " LIMIT ?", transactionRowMapper(), ownerId, accountId, accountId, limit);
        }
        return jdbcTemplate.query(sql, transactionRowMapper(), ownerId, accountId, accountId);
    }

    public List<Transaction> findByDebtId(UUID ownerId, UUID debtId) {
        return jdbcTemplate.query(
            SELECT_TRANSACTION + "WHERE t.owner_id = ? AND t.debt_id = ? ORDER BY t.transaction_date, t.created_at",
            transactionRowMapper(),
            ownerId,
            debtId
        );
    }

    /**
     * INCOME into the account, EXPENSE out of it and the number of transactions of
     * any kind touching it.
     */
    public AccountActivity summarizeActivity(UUID ownerId, UUID accountId) {
        return jdbcTemplate.queryForObject(
            "SELECT " +
            "  COALESCE(SUM(CASE WHEN kind = 'INCOME' AND destination_account_id = ? THEN amount END), 0) AS total_income, " +
            "  COALESCE(SUM(CASE WHEN kind = 'EXPENSE' AND source_account_id = ? THEN amount END), 0) AS total_expense, " +
            "  COUNT(*) AS transaction_count " +
            "FROM transactions " +
            "WHERE owner_id = ? AND (source_account_id = ? OR destination_account_id = ?)",
            (rs, rowNum) -> new AccountActivity(
                Rows.money(rs, "total_income"),
                Rows.money(rs, "total_expense"),
                rs.getLong("transaction_count")
            ),
            accountId,
            accountId,
            ownerId,
            accountId,
            accountId
        );
    }

    private RowMapper<Transaction> transactionRowMapper() {
        return (rs, rowNum) -> new Transaction(
            Rows.uuid(rs, "id"),
            Rows.uuid(rs, "owner_id"),
            TransactionKind.valueOf(rs.getString("kind")),
            Money.of(rs.getBigDecimal("amount")),
            Rows.date(rs, "transaction_date"),
            rs.getString("description"),
            Rows.uuid(rs, "category_id"),
            rs.getString("category_name"),
            Rows.uuid(rs, "source_account_id"),
            Rows.uuid(rs, "destination_account_id"),
            Rows.uuid(rs, "debt_id"),
            rs.getString("idempotency_key"),
            Rows.instant(rs, "created_at"),
            Rows.instant(rs, "updated_at")
        );
    }
}
