package com.demo.rent.service;

import com.demo.rent.repository.EligibilityRepository;
import com.demo.rent.repository.NullifierRepository;
import com.demo.rent.service.dto.GateInfo;
import com.demo.rent.service.eligibility.Attestation;
import com.demo.rent.service.eligibility.AttestationEligibilityVerifier;
import com.demo.rent.service.eligibility.AttestationTypedData;
import com.demo.rent.service.eligibility.EligibilityGate;
import com.demo.rent.service.eligibility.ProofClaim;
import com.demo.rent.service.eligibility.ProofVerifier;
import com.demo.rent.service.eligibility.SignedAttestation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/** Entry point for both claim variants and the shared eligibility lookups. */
@Service
@RequiredArgsConstructor
public class EligibilityService {

    private final EligibilityGate<ProofClaim> proofGate;
    private final EligibilityGate<SignedAttestation> attestationGate;
    private final EligibilityRepository eligibilityRepository;
    private final NullifierRepository nullifierRepository;
    private final ProofVerifier proofVerifier;
    private final AttestationEligibilityVerifier attestationVerifier;

    /** @return the consumed nullifier */
    public String submitProof(String caller, long policyId, byte[] proof, List<BigInteger> publicInputs) {
        return proofGate.submit(caller, new ProofClaim(policyId, proof, publicInputs));
    }

    /** @return the consumed nullifier */
    public String submitAttestation(String caller, Attestation attestation, byte[] signature) {
        return attestationGate.submit(caller, new SignedAttestation(attestation, signature));
    }

    public boolean isEligible(String identity, long policyId) {
        if (!HashUtil.isAddress(identity)) {
            return false;
        }
        return eligibilityRepository.isEligible(HashUtil.normalizeAddress(identity), policyId);
    }

    public boolean isNullifierUsed(String nullifier) {
        return nullifierRepository.isUsed(HashUtil.normalizeBytes32(nullifier));
    }

    /** Who consumed the nullifier, through which gate; empty while unused. */
    public Optional<NullifierRepository.NullifierRow> findNullifier(String nullifier) {
        return nullifierRepository.find(HashUtil.normalizeBytes32(nullifier));
    }

    public String constructNullifier(BigInteger hi, BigInteger lo) {
        return HashUtil.nullifierFromLimbs(hi, lo);
    }

    public GateInfo gateInfo() {
        AttestationTypedData td = attestationVerifier.getTypedData();
        return new GateInfo(
                proofVerifier.name(),
                proofVerifier.productionSafe(),
                attestationVerifier.getTrustedIssuer(),
                td.getChainId(),
                td.getVerifyingContract(),
                td.domainSeparatorHex());
    }
}
