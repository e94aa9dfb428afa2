package com.flagship.fund_ledger.ledger.store;

import com.flagship.fund_ledger.ledger.FundingSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Funding sources, resolved by name with an idempotent insert.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class FundingSourceRepository {

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    /**
     * Finds the source named {@code name} (case-insensitive) or creates it.
     *
     * The insert yields to the unique index on {@code (owner_id, lower(name))}, so two
     * callers racing on the same new name both end up with the single surviving row.
     * The category only applies when the row is created.
     */
    public FundingSource resolveOrCreate(UUID ownerId, String name, FundingSource.Category category) {
        String trimmed = name.trim();
        int inserted = jdbcTemplate.update(
            "INSERT INTO funding_sources (id, owner_id, name, category) VALUES (?, ?, ?, ?) " +
            "ON CONFLICT DO NOTHING",
            UUID.randomUUID(),
            ownerId,
            trimmed,
            category.name()
        );
        if (inserted == 1) {
            log.debug("Created funding source '{}' ({})", trimmed, category);
        }
        return jdbcTemplate.queryForObject(
            "SELECT id, owner_id, name, category, created_at FROM funding_sources " +
            "WHERE owner_id = ? AND lower(name) = lower(?)",
            fundingSourceRowMapper(),
            ownerId,
            trimmed
        );
    }

    /**
     * Loads the owner's sources among {@code ids}. Ids owned by someone else are
     * simply absent from the result.
     */
    public Map<UUID, FundingSource> findByIds(UUID ownerId, Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("ids", ids);
        return namedJdbcTemplate.query(
                "SELECT id, owner_id, name, category, created_at FROM funding_sources " +
                "WHERE owner_id = :ownerId AND id IN (:ids)",
                params,
                fundingSourceRowMapper())
            .stream()
            .collect(Collectors.toMap(FundingSource::getId, Function.identity()));
    }

    public List<FundingSource> findAllByOwner(UUID ownerId) {
        return jdbcTemplate.query(
            "SELECT id, owner_id, name, category, created_at FROM funding_sources " +
            "WHERE owner_id = ? ORDER BY lower(name)",
            fundingSourceRowMapper(),
            ownerId
        );
    }

    private RowMapper<FundingSource> fundingSourceRowMapper() {
        return (rs, rowNum) -> new FundingSource(
            Rows.uuid(rs, "id"),
            Rows.uuid(rs, "owner_id"),
            rs.getString("name"),
            FundingSource.Category.valueOf(rs.getString("category")),
            Rows.instant(rs, "created_at")
        );
    }
}
