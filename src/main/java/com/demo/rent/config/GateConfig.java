package com.demo.rent.config;

import com.demo.rent.repository.EligibilityRepository;
import com.demo.rent.repository.NullifierRepository;
import com.demo.rent.service.LedgerSequencer;
import com.demo.rent.service.PolicyService;
import com.demo.rent.service.eligibility.AttestationEligibilityVerifier;
import com.demo.rent.service.eligibility.AttestationTypedData;
import com.demo.rent.service.eligibility.ContractProofVerifier;
import com.demo.rent.service.eligibility.EligibilityGate;
import com.demo.rent.service.eligibility.InsecureDemoProofVerifier;
import com.demo.rent.service.eligibility.ProofClaim;
import com.demo.rent.service.eligibility.ProofEligibilityVerifier;
import com.demo.rent.service.eligibility.ProofVerifier;
import com.demo.rent.service.eligibility.SignedAttestation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;

/** Wires one gate per verification strategy over the shared stores. */
@Configuration
public class GateConfig {

    public static final String VERIFIER_CONTRACT = "contract";
    public static final String VERIFIER_INSECURE_STUB = "insecure-demo-stub";

    @Bean
    public ProofVerifier proofVerifier(Web3j web3j,
                                       @Value("${gate.proof.verifier:contract}") String mode,
                                       @Value("${gate.proof.contract-address:}") String contractAddress) {
        if (VERIFIER_CONTRACT.equals(mode)) {
            return new ContractProofVerifier(web3j, contractAddress);
        }
        if (VERIFIER_INSECURE_STUB.equals(mode)) {
            return new InsecureDemoProofVerifier();
        }
        throw new IllegalStateException("Unknown gate.proof.verifier '" + mode + "' (expected "
                + VERIFIER_CONTRACT + " or " + VERIFIER_INSECURE_STUB + ")");
    }

    @Bean
    public AttestationTypedData attestationTypedData(
            @Value("${gate.attestation.chain-id:31337}") long chainId,
            @Value("${gate.attestation.verifying-contract:0x0000000000000000000000000000000000000000}") String verifyingContract) {
        return new AttestationTypedData(chainId, verifyingContract);
    }

    @Bean
    public AttestationEligibilityVerifier attestationEligibilityVerifier(
            AttestationTypedData typedData,
            @Value("${gate.attestation.issuer:}") String issuer) {
        return new AttestationEligibilityVerifier(typedData, issuer);
    }

    @Bean
    public EligibilityGate<ProofClaim> proofGate(PolicyService policyService,
                                                 ProofVerifier proofVerifier,
                                                 NullifierRepository nullifierRepository,
                                                 EligibilityRepository eligibilityRepository,
                                                 LedgerSequencer ledger) {
        return new EligibilityGate<>(policyService, new ProofEligibilityVerifier(proofVerifier),
                nullifierRepository, eligibilityRepository, ledger);
    }

    @Bean
    public EligibilityGate<SignedAttestation> attestationGate(PolicyService policyService,
                                                              AttestationEligibilityVerifier verifier,
                                                              NullifierRepository nullifierRepository,
                                                              EligibilityRepository eligibilityRepository,
                                                              LedgerSequencer ledger) {
        return new EligibilityGate<>(policyService, verifier, nullifierRepository, eligibilityRepository, ledger);
    }
}
