package com.demo.rent.service.eligibility;

/** A proof or signed attestation that a tenant satisfies a policy. */
public interface EligibilityClaim {

    long policyId();
}
