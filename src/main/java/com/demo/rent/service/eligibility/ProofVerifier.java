package com.demo.rent.service.eligibility;

import java.math.BigInteger;
import java.util.List;

/** Succinct proof check against public inputs. */
public interface ProofVerifier {

    boolean verify(byte[] proof, List<BigInteger> publicInputs);

    String name();

    /** False for implementations that do not actually check proofs. */
    default boolean productionSafe() {
        return true;
    }
}
