package com.demo.rent.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class LeaseRepository {

    private final JdbcTemplate jdbc;

    public Optional<Lease> find(long policyId, String tenant) {
        String sql = """
            SELECT policy_id, tenant, amount, deadline, status, instance, started_at, resolved_at
            FROM leases
            WHERE policy_id = ? AND tenant = ?
        """;
        return jdbc.query(sql, rm(), policyId, tenant).stream().findFirst();
    }

    public void insert(Lease l) {
        jdbc.update("""
            INSERT INTO leases (policy_id, tenant, amount, deadline, status, instance, started_at, resolved_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, NULL)
        """, l.policyId(), l.tenant(), new BigDecimal(l.amount()), l.deadline(),
                l.status().name(), l.instance(), l.startedAt());
    }

    /** Replaces a terminal lease with a fresh instantiation. No-op if the current row is still ACTIVE. */
    public boolean restart(Lease l) {
        int n = jdbc.update("""
            UPDATE leases
            SET amount = ?, deadline = ?, status = ?, instance = ?, started_at = ?, resolved_at = NULL
            WHERE policy_id = ? AND tenant = ? AND status <> 'ACTIVE'
        """, new BigDecimal(l.amount()), l.deadline(), l.status().name(), l.instance(), l.startedAt(),
                l.policyId(), l.tenant());
        return n == 1;
    }

    /** Moves an ACTIVE lease to a terminal status; false if it was not active. */
    public boolean resolve(long policyId, String tenant, LeaseStatus terminal, long resolvedAt) {
        int n = jdbc.update("""
            UPDATE leases
            SET status = ?, resolved_at = ?
            WHERE policy_id = ? AND tenant = ? AND status = 'ACTIVE'
        """, terminal.name(), resolvedAt, policyId, tenant);
        return n == 1;
    }

    /** Funds currently held in custody. */
    public BigInteger activeTotal() {
        BigDecimal sum = jdbc.queryForObject(
                "SELECT COALESCE(SUM(amount), 0) FROM leases WHERE status = 'ACTIVE'", BigDecimal.class);
        return sum == null ? BigInteger.ZERO : sum.toBigIntegerExact();
    }

    private RowMapper<Lease> rm() {
        return (rs, i) -> new Lease(
                rs.getLong("policy_id"),
                rs.getString("tenant"),
                rs.getBigDecimal("amount").toBigIntegerExact(),
                rs.getLong("deadline"),
                LeaseStatus.valueOf(rs.getString("status")),
                rs.getInt("instance"),
                rs.getLong("started_at"),
                rs.getObject("resolved_at", Long.class)
        );
    }
}
