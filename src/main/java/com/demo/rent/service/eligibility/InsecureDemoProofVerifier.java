package com.demo.rent.service.eligibility;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;

/**
 * NOT FOR PRODUCTION. Accepts every proof, which removes every eligibility
 * guarantee of the proof gate. Only selectable through
 * {@code gate.proof.verifier=insecure-demo-stub}.
 */
@Slf4j
public class InsecureDemoProofVerifier implements ProofVerifier {

    public static final String NAME = "INSECURE-DEMO-STUB (accepts every proof)";

    public InsecureDemoProofVerifier() {
        log.warn("************************************************************");
        log.warn("* INSECURE demo proof verifier active: ALL proofs accepted *");
        log.warn("* Never run this configuration against real funds.         *");
        log.warn("************************************************************");
    }

    @Override
    public boolean verify(byte[] proof, List<BigInteger> publicInputs) {
        log.warn("INSECURE demo verifier accepted a proof without checking it ({} public inputs)",
                publicInputs == null ? 0 : publicInputs.size());
        return true;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean productionSafe() {
        return false;
    }
}
