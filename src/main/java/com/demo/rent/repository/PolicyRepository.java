package com.demo.rent.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PolicyRepository {

    private final JdbcTemplate jdbc;

    /** Only meaningful under the ledger lock; ids are gap-free because a rolled back insert leaves MAX unchanged. */
    public long nextId() {
        Long max = jdbc.queryForObject("SELECT COALESCE(MAX(policy_id), 0) FROM policies", Long.class);
        return (max == null ? 0L : max) + 1;
    }

    public void insert(Policy p) {
        jdbc.update("""
            INSERT INTO policies (policy_id, min_age, income_multiplier, rent_amount,
                                  require_clean_record, deadline, owner_address, content_hash, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """,
                p.policyId(), p.minAge(), p.incomeMultiplier(), new BigDecimal(p.rentAmount()),
                p.requireCleanRecord(), p.deadline(), p.owner(), p.contentHash(), p.createdAt());
    }

    public Optional<Policy> findById(long policyId) {
        String sql = """
            SELECT policy_id, min_age, income_multiplier, rent_amount, require_clean_record,
                   deadline, owner_address, content_hash, created_at
            FROM policies
            WHERE policy_id = ?
        """;
        return jdbc.query(sql, rm(), policyId).stream().findFirst();
    }

    public long count() {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM policies", Long.class);
        return n == null ? 0L : n;
    }

    private RowMapper<Policy> rm() {
        return (rs, i) -> new Policy(
                rs.getLong("policy_id"),
                rs.getInt("min_age"),
                rs.getInt("income_multiplier"),
                rs.getBigDecimal("rent_amount").toBigIntegerExact(),
                rs.getBoolean("require_clean_record"),
                rs.getLong("deadline"),
                rs.getString("owner_address"),
                rs.getString("content_hash"),
                rs.getLong("created_at")
        );
    }
}
