package com.demo.rent.service.eligibility;

/** An attestation together with its 65-byte r||s||v signature. */
public record SignedAttestation(Attestation attestation, byte[] signature) implements EligibilityClaim {

    public SignedAttestation {
        signature = signature == null ? new byte[0] : signature.clone();
    }

    @Override
    public long policyId() {
        return attestation.policyId();
    }
}
