package com.demo.rent.service.eligibility;

import com.demo.rent.repository.EligibilityRepository;
import com.demo.rent.repository.NullifierRepository;
import com.demo.rent.repository.Policy;
import com.demo.rent.service.HashUtil;
import com.demo.rent.service.LedgerSequencer;
import com.demo.rent.service.PolicyService;
import com.demo.rent.service.error.ErrorCode;
import com.demo.rent.service.error.ExpiryException;
import com.demo.rent.service.error.ReplayException;
import com.demo.rent.service.event.Eligible;
import lombok.extern.slf4j.Slf4j;

/**
 * Claim submission for one verification strategy. Replay protection and the
 * eligibility record are shared with every other gate.
 */
@Slf4j
public class EligibilityGate<C extends EligibilityClaim> {

    private final PolicyService policyService;
    private final EligibilityVerifier<C> verifier;
    private final NullifierRepository nullifierRepository;
    private final EligibilityRepository eligibilityRepository;
    private final LedgerSequencer ledger;

    public EligibilityGate(PolicyService policyService,
                           EligibilityVerifier<C> verifier,
                           NullifierRepository nullifierRepository,
                           EligibilityRepository eligibilityRepository,
                           LedgerSequencer ledger) {
        this.policyService = policyService;
        this.verifier = verifier;
        this.nullifierRepository = nullifierRepository;
        this.eligibilityRepository = eligibilityRepository;
        this.ledger = ledger;
    }

    /** @return the consumed nullifier */
    public String submit(String caller, C claim) {
        String tenant = HashUtil.normalizeAddress(caller);
        return ledger.execute("submit-" + verifier.gate(), () -> {
            verifier.checkCaller(tenant, claim);

            Policy policy = policyService.getPolicy(claim.policyId());
            long now = ledger.now();
            if (policy.isExpiredAt(now)) {
                throw new ExpiryException(ErrorCode.POLICY_EXPIRED,
                        "Policy " + policy.policyId() + " deadline passed at " + policy.deadline());
            }

            String nullifier = verifier.verify(policy, claim, now);

            if (!nullifierRepository.markUsed(nullifier, verifier.gate(), tenant, policy.policyId(), now)) {
                throw new ReplayException(nullifier);
            }
            boolean first = eligibilityRepository.grant(tenant, policy.policyId(), nullifier, now);

            ledger.emit(new Eligible(tenant, policy.policyId(), nullifier));
            log.info("Tenant {} eligible for policy {} via {} gate (nullifier {}{})",
                    tenant, policy.policyId(), verifier.gate(), nullifier, first ? "" : ", already eligible");
            return nullifier;
        });
    }

    public EligibilityVerifier<C> getVerifier() {
        return verifier;
    }
}
