package com.flagship.fund_ledger.ledger.store;

import com.flagship.fund_ledger.ledger.FundingAllocation;
import com.flagship.fund_ledger.ledger.allocation.ProvenanceMovement;
import com.flagship.fund_ledger.ledger.allocation.SourceAmount;
import com.flagship.fund_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Provenance rows. Written and deleted as a batch together with their transaction.
 */
@Repository
@RequiredArgsConstructor
public class FundingAllocationRepository {

    private static final String SELECT_ALLOCATION =
        "SELECT fa.transaction_id, fa.funding_source_id, fs.name AS funding_source_name, fa.amount " +
        "FROM funding_allocations fa JOIN funding_sources fs ON fs.id = fa.funding_source_id ";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public void insertAll(UUID transactionId, List<SourceAmount> allocations) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO funding_allocations (transaction_id, funding_source_id, amount) VALUES (?, ?, ?)",
            allocations,
            allocations.size(),
            (ps, allocation) -> {
                ps.setObject(1, transactionId);
                ps.setObject(2, allocation.getFundingSourceId());
                ps.setBigDecimal(3, allocation.getAmount().toBigDecimal());
            }
        );
    }

    public List<FundingAllocation> findByTransactionId(UUID transactionId) {
        return jdbcTemplate.query(
            SELECT_ALLOCATION + "WHERE fa.transaction_id = ? ORDER BY fa.sequence_number",
            allocationRowMapper(),
            transactionId
        );
    }

    public Map<UUID, List<FundingAllocation>> findByTransactionIds(Collection<UUID> transactionIds) {
        if (transactionIds.isEmpty()) {
            return Map.of();
        }
        return namedJdbcTemplate.query(
                SELECT_ALLOCATION + "WHERE fa.transaction_id IN (:ids) ORDER BY fa.sequence_number",
                new MapSqlParameterSource("ids", transactionIds),
                allocationRowMapper())
            .stream()
            .collect(Collectors.groupingBy(FundingAllocation::getTransactionId));
    }

    public int deleteByTransactionId(UUID transactionId) {
        return jdbcTemplate.update("DELETE FROM funding_allocations WHERE transaction_id = ?", transactionId);
    }

    /**
     * Every allocation row of every transaction touching the account, labelled CREDIT
     * when the account is the transaction's destination and DEBIT when it is the source.
     */
    public List<ProvenanceMovement> findMovementsForAccount(UUID ownerId, UUID accountId) {
        return jdbcTemplate.query(
            "SELECT fa.funding_source_id, fs.name AS funding_source_name, fa.amount, " +
            "       CASE WHEN t.destination_account_id = ? THEN 'CREDIT' ELSE 'DEBIT' END AS direction " +
            "FROM funding_allocations fa " +
            "JOIN transactions t ON t.id = fa.transaction_id " +
            "JOIN funding_sources fs ON fs.id = fa.funding_source_id " +
            "WHERE t.owner_id = ? AND (t.destination_account_id = ? OR t.source_account_id = ?)",
            (rs, rowNum) -> new ProvenanceMovement(
                Rows.uuid(rs, "funding_source_id"),
                rs.getString("funding_source_name"),
                ProvenanceMovement.Direction.valueOf(rs.getString("direction")),
                Money.of(rs.getBigDecimal("amount"))
            ),
            accountId,
            ownerId,
            accountId,
            accountId
        );
    }

    private RowMapper<FundingAllocation> allocationRowMapper() {
        return (rs, rowNum) -> new FundingAllocation(
            Rows.uuid(rs, "transaction_id"),
            Rows.uuid(rs, "funding_source_id"),
            rs.getString("funding_source_name"),
            Money.of(rs.getBigDecimal("amount"))
        );
    }
}
