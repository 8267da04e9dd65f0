package com.demo.rent.repository;

import java.math.BigInteger;

/** Immutable rental terms. contentHash commits to every field except id and timestamps. */
public record Policy(
        long policyId,
        int minAge,
        int incomeMultiplier,
        BigInteger rentAmount,
        boolean requireCleanRecord,
        long deadline,
        String owner,
        String contentHash,
        long createdAt
) {
    public int requireCleanRecordAsInt() {
        return requireCleanRecord ? 1 : 0;
    }

    /** Equal-to-deadline counts as passed. */
    public boolean isExpiredAt(long now) {
        return now >= deadline;
    }
}
