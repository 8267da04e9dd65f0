package com.demo.rent.service.eligibility;

import com.demo.rent.service.HashUtil;
import com.demo.rent.service.error.ErrorCode;
import com.demo.rent.service.error.ValidationException;

/**
 * Issuer-signed claim about a wallet. passBitmask bits: 0 age, 1 income, 2 clean record.
 */
public record Attestation(String wallet, long policyId, long expiry, String nullifier, int passBitmask) {

    public static final int ALL_CHECKS_PASSED = 0b111;

    public Attestation {
        wallet = HashUtil.normalizeAddress(wallet);
        nullifier = HashUtil.normalizeBytes32(nullifier);
        if (policyId < 0 || expiry < 0) {
            throw new ValidationException(ErrorCode.PARAMETER_MISMATCH, "policyId and expiry must be unsigned");
        }
        if (passBitmask < 0 || passBitmask > 0xff) {
            throw new ValidationException(ErrorCode.PARAMETER_MISMATCH, "passBitmask must fit in uint8");
        }
    }

    public boolean allChecksPassed() {
        return passBitmask == ALL_CHECKS_PASSED;
    }
}
