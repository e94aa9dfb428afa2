package com.flagship.fund_ledger.ledger.store;

import com.flagship.fund_ledger.account.Account;
import com.flagship.fund_ledger.account.AccountKind;
import com.flagship.fund_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account rows and the balance primitives.
 *
 * Balances are never written by read-then-write. Increments are a single
 * {@code balance = balance + x} statement; decrements are conditional on the
 * resulting balance staying at or above the account's floor.
 */
@Repository
@RequiredArgsConstructor
public class AccountRepository {

    private static final String SELECT_ACCOUNT =
        "SELECT id, owner_id, name, kind, balance, credit_limit, statement_day, due_day, created_at, updated_at " +
        "FROM accounts ";

    private final JdbcTemplate jdbcTemplate;

    public void insert(Account account) {
        jdbcTemplate.update(
            "INSERT INTO accounts (id, owner_id, name, kind, balance, credit_limit, statement_day, due_day) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            account.getId(),
            account.getOwnerId(),
            account.getName(),
            account.getKind().name(),
            account.getBalance().toBigDecimal(),
            Rows.decimal(account.getCreditLimit()),
            account.getStatementDay(),
            account.getDueDay()
        );
    }

    public Optional<Account> findById(UUID ownerId, UUID accountId) {
        List<Account> rows = jdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE id = ? AND owner_id = ?",
            accountRowMapper(),
            accountId,
            ownerId
        );
        return rows.stream().findFirst();
    }

    /**
     * Same as {@link #findById} but holds the row lock until the surrounding
     * transaction ends. Writers that read an account's tag balances take this lock
     * first, so their allocation plans are computed one at a time.
     */
    public Optional<Account> findByIdForUpdate(UUID ownerId, UUID accountId) {
        List<Account> rows = jdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE id = ? AND owner_id = ? FOR UPDATE",
            accountRowMapper(),
            accountId,
            ownerId
        );
        return rows.stream().findFirst();
    }

    public List<Account> findAllByOwner(UUID ownerId) {
        return jdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE owner_id = ? ORDER BY lower(name), created_at",
            accountRowMapper(),
            ownerId
        );
    }

    /**
     * Unconditional atomic increment (or, with a negative delta, an unconditional
     * decrement used when undoing an earlier credit).
     */
    public void adjustBalance(UUID accountId, Money delta) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET balance = balance + ?, updated_at = clock_timestamp() WHERE id = ?",
            delta.toBigDecimal(),
            accountId
        );
        if (updated != 1) {
            throw new IllegalStateException("Balance adjustment matched " + updated + " rows for account " + accountId);
        }
    }

    /**
     * Increments only if the resulting balance still fits the balance column.
     *
     * @return false when the new balance would be out of range
     */
    public boolean incrementWithinRange(UUID accountId, Money amount) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET balance = balance + ?, updated_at = clock_timestamp() " +
            "WHERE id = ? AND balance + ? < ?",
            amount.toBigDecimal(),
            accountId,
            amount.toBigDecimal(),
            Money.STORABLE_LIMIT
        );
        return updated == 1;
    }

    /**
     * Decrements only if the balance stays at or above {@code floor}.
     *
     * @return false when the condition did not hold at execution time
     */
    public boolean decrementIfCovered(UUID accountId, Money amount, Money floor) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET balance = balance - ?, updated_at = clock_timestamp() " +
            "WHERE id = ? AND balance - ? >= ?",
            amount.toBigDecimal(),
            accountId,
            amount.toBigDecimal(),
            floor.toBigDecimal()
        );
        return updated == 1;
    }

    public Money findBalance(UUID accountId) {
        return Money.of(jdbcTemplate.queryForObject(
            "SELECT balance FROM accounts WHERE id = ?",
            BigDecimal.class,
            accountId
        ));
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            Rows.uuid(rs, "id"),
            Rows.uuid(rs, "owner_id"),
            rs.getString("name"),
            AccountKind.valueOf(rs.getString("kind")),
            Rows.money(rs, "balance"),
            Rows.money(rs, "credit_limit"),
            Rows.integer(rs, "statement_day"),
            Rows.integer(rs, "due_day"),
            Rows.instant(rs, "created_at"),
            Rows.instant(rs, "updated_at")
        );
    }
}
