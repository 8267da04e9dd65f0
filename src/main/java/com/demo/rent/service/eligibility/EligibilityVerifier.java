package com.demo.rent.service.eligibility;

import com.demo.rent.repository.Policy;

/**
 * Pass/fail check of one claim variant. Failures are signalled by throwing a
 * {@link com.demo.rent.service.error.RentGateException} subtype.
 */
public interface EligibilityVerifier<C extends EligibilityClaim> {

    /** Tag stored next to every nullifier this verifier lets through. */
    String gate();

    /** Caller-only checks, run before the policy is loaded. */
    default void checkCaller(String caller, C claim) {
    }

    /**
     * @param now host time in epoch seconds
     * @return the claim's nullifier as bytes32 hex
     */
    String verify(Policy policy, C claim, long now);
}
