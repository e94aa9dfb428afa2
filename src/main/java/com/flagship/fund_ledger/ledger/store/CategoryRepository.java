package com.flagship.fund_ledger.ledger.store;

import com.flagship.fund_ledger.ledger.TransactionKind;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Categories are labels per (owner, name, transaction kind), resolved the same way
 * as funding sources.
 */
@Repository
@RequiredArgsConstructor
public class CategoryRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * @return the category id, or null for a blank name
     */
    public UUID resolveOrCreate(UUID ownerId, String name, TransactionKind kind) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String trimmed = name.trim();
        jdbcTemplate.update(
            "INSERT INTO categories (id, owner_id, name, kind) VALUES (?, ?, ?, ?) ON CONFLICT DO NOTHING",
            UUID.randomUUID(),
            ownerId,
            trimmed,
            kind.name()
        );
        return jdbcTemplate.queryForObject(
            "SELECT id FROM categories WHERE owner_id = ? AND lower(name) = lower(?) AND kind = ?",
            (rs, rowNum) -> Rows.uuid(rs, "id"),
            ownerId,
            trimmed,
            kind.name()
        );
    }
}
