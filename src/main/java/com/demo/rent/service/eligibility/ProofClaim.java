package com.demo.rent.service.eligibility;

import com.demo.rent.service.error.ErrorCode;
import com.demo.rent.service.error.ValidationException;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * publicInputs: [minAge, incomeMultiplier, rentAmount, requireCleanRecord, policyId, nullifierHi, nullifierLo].
 */
public record ProofClaim(long policyId, byte[] proof, List<BigInteger> publicInputs) implements EligibilityClaim {

    public ProofClaim {
        if (publicInputs == null || publicInputs.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException(ErrorCode.PARAMETER_MISMATCH, "Public inputs must be non-null integers");
        }
        proof = proof == null ? new byte[0] : proof.clone();
        publicInputs = List.copyOf(publicInputs);
    }
}
