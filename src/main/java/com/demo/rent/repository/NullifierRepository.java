package com.demo.rent.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/** One global set of consumed nullifiers, shared by both gates. */
@Repository
@RequiredArgsConstructor
public class NullifierRepository {

    private final JdbcTemplate jdbc;

    /**
     * Insert-if-absent on the primary key, so the membership check and the insert
     * are one statement.
     *
     * @return false when the nullifier was already consumed
     */
    public boolean markUsed(String nullifier, String gate, String tenant, long policyId, long consumedAt) {
        try {
            jdbc.update("""
                INSERT INTO nullifiers (nullifier, gate, tenant, policy_id, consumed_at)
                VALUES (?, ?, ?, ?, ?)
            """, nullifier, gate, tenant, policyId, consumedAt);
            return true;
        } catch (DuplicateKeyException dup) {
            return false;
        }
    }

    public boolean isUsed(String nullifier) {
        return find(nullifier).isPresent();
    }

    public Optional<NullifierRow> find(String nullifier) {
        String sql = """
            SELECT nullifier, gate, tenant, policy_id, consumed_at
            FROM nullifiers
            WHERE nullifier = ?
        """;
        return jdbc.query(sql, (rs, i) -> new NullifierRow(
                rs.getString("nullifier"),
                rs.getString("gate"),
                rs.getString("tenant"),
                rs.getLong("policy_id"),
                rs.getLong("consumed_at")
        ), nullifier).stream().findFirst();
    }

    public record NullifierRow(String nullifier, String gate, String tenant, long policyId, long consumedAt) {}
}
