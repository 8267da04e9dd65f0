package com.demo.rent.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/** (tenant, policyId) -> eligible. Rows are only ever inserted. */
@Repository
@RequiredArgsConstructor
public class EligibilityRepository {

    private final JdbcTemplate jdbc;

    /** @return true if this call created the record, false if the pair was already eligible */
    public boolean grant(String tenant, long policyId, String nullifier, long grantedAt) {
        if (find(tenant, policyId).isPresent()) {
            return false;
        }
        jdbc.update("""
            INSERT INTO eligibility (tenant, policy_id, nullifier, granted_at)
            VALUES (?, ?, ?, ?)
        """, tenant, policyId, nullifier, grantedAt);
        return true;
    }

    public boolean isEligible(String tenant, long policyId) {
        return find(tenant, policyId).isPresent();
    }

    public Optional<EligibilityRow> find(String tenant, long policyId) {
        String sql = """
            SELECT tenant, policy_id, nullifier, granted_at
            FROM eligibility
            WHERE tenant = ? AND policy_id = ?
        """;
        return jdbc.query(sql, (rs, i) -> new EligibilityRow(
                rs.getString("tenant"),
                rs.getLong("policy_id"),
                rs.getString("nullifier"),
                rs.getLong("granted_at")
        ), tenant, policyId).stream().findFirst();
    }

    public record EligibilityRow(String tenant, long policyId, String nullifier, long grantedAt) {}
}
