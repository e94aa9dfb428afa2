package com.flagship.fund_ledger.ledger.store;

import com.flagship.fund_ledger.ledger.LineItem;
import com.flagship.fund_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Line items of itemized expenses, kept in entry order.
 */
@Repository
@RequiredArgsConstructor
public class LineItemRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * @param categoryIds resolved category per item, same order as {@code items}, null entries allowed
     */
    public void insertAll(UUID transactionId, List<LineItem> items, List<UUID> categoryIds) {
        List<Object[]> batch = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            LineItem item = items.get(i);
            batch.add(new Object[] {
                transactionId, i, item.getName().trim(), item.getUnitPrice().toBigDecimal(),
                item.getQuantity(), categoryIds.get(i)
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO transaction_items (transaction_id, position, name, unit_price, quantity, category_id) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            batch
        );
    }

    public List<LineItem> findByTransactionId(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT i.name, i.unit_price, i.quantity, c.name AS category_name " +
            "FROM transaction_items i LEFT JOIN categories c ON c.id = i.category_id " +
            "WHERE i.transaction_id = ? ORDER BY i.position",
            (rs, rowNum) -> new LineItem(
                rs.getString("name"),
                Money.of(rs.getBigDecimal("unit_price")),
                rs.getInt("quantity"),
                rs.getString("category_name")
            ),
            transactionId
        );
    }

    public int deleteByTransactionId(UUID transactionId) {
        return jdbcTemplate.update("DELETE FROM transaction_items WHERE transaction_id = ?", transactionId);
    }
}
