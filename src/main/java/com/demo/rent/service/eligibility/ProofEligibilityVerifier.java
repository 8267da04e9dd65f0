package com.demo.rent.service.eligibility;

import com.demo.rent.repository.Policy;
import com.demo.rent.service.HashUtil;
import com.demo.rent.service.error.ErrorCode;
import com.demo.rent.service.error.ValidationException;
import com.demo.rent.service.error.VerificationException;

import java.math.BigInteger;
import java.util.List;

/**
 * Binds a proof to the stored terms of the policy it is submitted against, then
 * hands it to the configured {@link ProofVerifier}.
 */
public class ProofEligibilityVerifier implements EligibilityVerifier<ProofClaim> {

    public static final String GATE = "proof";
    public static final int PUBLIC_INPUT_COUNT = 7;

    private static final String[] BOUND_INPUTS =
            {"minAge", "incomeMultiplier", "rentAmount", "requireCleanRecord", "policyId"};

    private final ProofVerifier proofVerifier;

    public ProofEligibilityVerifier(ProofVerifier proofVerifier) {
        this.proofVerifier = proofVerifier;
    }

    @Override
    public String gate() {
        return GATE;
    }

    @Override
    public String verify(Policy policy, ProofClaim claim, long now) {
        List<BigInteger> inputs = claim.publicInputs();
        if (inputs.size() != PUBLIC_INPUT_COUNT) {
            throw new ValidationException(ErrorCode.PARAMETER_MISMATCH,
                    "Expected " + PUBLIC_INPUT_COUNT + " public inputs, got " + inputs.size());
        }
        List<BigInteger> expected = boundInputs(policy);
        for (int i = 0; i < expected.size(); i++) {
            if (!expected.get(i).equals(inputs.get(i))) {
                throw new ValidationException(ErrorCode.PARAMETER_MISMATCH, BOUND_INPUTS[i] + " mismatch");
            }
        }
        String nullifier = HashUtil.nullifierFromLimbs(inputs.get(5), inputs.get(6));

        if (!proofVerifier.verify(claim.proof(), inputs)) {
            throw new VerificationException(ErrorCode.VERIFICATION_FAILED,
                    "Proof rejected by " + proofVerifier.name());
        }
        return nullifier;
    }

    /** The first five public inputs, derived from the stored policy. */
    static List<BigInteger> boundInputs(Policy policy) {
        return List.of(
                BigInteger.valueOf(policy.minAge()),
                BigInteger.valueOf(policy.incomeMultiplier()),
                policy.rentAmount(),
                BigInteger.valueOf(policy.requireCleanRecordAsInt()),
                BigInteger.valueOf(policy.policyId()));
    }

    /** Full public input vector a prover must commit to for this policy. */
    public static List<BigInteger> publicInputsFor(Policy policy, BigInteger nullifierHi, BigInteger nullifierLo) {
        List<BigInteger> bound = boundInputs(policy);
        return List.of(bound.get(0), bound.get(1), bound.get(2), bound.get(3), bound.get(4),
                nullifierHi, nullifierLo);
    }

    public ProofVerifier getProofVerifier() {
        return proofVerifier;
    }
}
