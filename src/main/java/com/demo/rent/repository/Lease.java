package com.demo.rent.repository;

import java.math.BigInteger;

/**
 * Escrowed rent for one (policyId, tenant). {@code instance} counts restarts of
 * the pair after a terminal resolution.
 */
public record Lease(
        long policyId,
        String tenant,
        BigInteger amount,
        long deadline,
        LeaseStatus status,
        int instance,
        long startedAt,
        Long resolvedAt
) {
    public boolean active() {
        return status == LeaseStatus.ACTIVE;
    }
}
