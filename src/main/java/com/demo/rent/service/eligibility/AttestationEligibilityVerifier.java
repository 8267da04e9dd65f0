package com.demo.rent.service.eligibility;

import com.demo.rent.repository.Policy;
import com.demo.rent.service.HashUtil;
import com.demo.rent.service.error.AuthorizationException;
import com.demo.rent.service.error.ErrorCode;
import com.demo.rent.service.error.ExpiryException;
import com.demo.rent.service.error.IneligibleException;
import com.demo.rent.service.error.VerificationException;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * Accepts attestations signed by exactly one trusted issuer, fixed at construction.
 */
public class AttestationEligibilityVerifier implements EligibilityVerifier<SignedAttestation> {

    public static final String GATE = "attestation";

    /** secp256k1 n / 2; signatures above it are the malleable twin and are refused. */
    static final BigInteger HALF_CURVE_ORDER = new BigInteger(
            "7FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF5D576E7357A4501DDFE92F46681B20A0", 16);

    private final AttestationTypedData typedData;
    private final String trustedIssuer;

    public AttestationEligibilityVerifier(AttestationTypedData typedData, String trustedIssuer) {
        if (!HashUtil.isAddress(trustedIssuer) || HashUtil.isZeroAddress(trustedIssuer)) {
            throw new IllegalArgumentException("gate.attestation.issuer must be a non-zero address, got '"
                    + trustedIssuer + "'");
        }
        this.typedData = typedData;
        this.trustedIssuer = HashUtil.normalizeAddress(trustedIssuer);
    }

    @Override
    public String gate() {
        return GATE;
    }

    @Override
    public void checkCaller(String caller, SignedAttestation claim) {
        if (HashUtil.ZERO_ADDRESS.equals(caller)) {
            throw new AuthorizationException("Zero address cannot submit attestations");
        }
        if (!claim.attestation().wallet().equals(caller)) {
            throw new AuthorizationException("Wallet mismatch: attestation is for " + claim.attestation().wallet());
        }
    }

    @Override
    public String verify(Policy policy, SignedAttestation claim, long now) {
        Attestation a = claim.attestation();
        if (now >= a.expiry()) {
            throw new ExpiryException(ErrorCode.CLAIM_EXPIRED, "Attestation expired at " + a.expiry());
        }
        if (!a.allChecksPassed()) {
            throw new IneligibleException(ErrorCode.INELIGIBLE,
                    "Not all checks passed (bitmask 0b" + Integer.toBinaryString(a.passBitmask()) + ")");
        }
        String signer = recoverSigner(a, claim.signature());
        if (!trustedIssuer.equals(signer)) {
            throw new VerificationException(ErrorCode.INVALID_SIGNATURE,
                    "Attestation signed by " + signer + ", not the trusted issuer");
        }
        return a.nullifier();
    }

    /** Address that produced {@code signature} over the attestation's EIP-712 digest. */
    public String recoverSigner(Attestation attestation, byte[] signature) {
        Sign.SignatureData sig = parseSignature(signature);
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(typedData.digest(attestation), sig);
            return "0x" + Keys.getAddress(publicKey);
        } catch (SignatureException | RuntimeException e) {
            throw new VerificationException(ErrorCode.INVALID_SIGNATURE,
                    "Signature recovery failed: " + e.getMessage(), e);
        }
    }

    static Sign.SignatureData parseSignature(byte[] signature) {
        if (signature == null || signature.length != 65) {
            throw new VerificationException(ErrorCode.INVALID_SIGNATURE, "Signature must be 65 bytes");
        }
        byte v = signature[64];
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw new VerificationException(ErrorCode.INVALID_SIGNATURE, "Invalid signature v: " + v);
        }
        byte[] r = Arrays.copyOfRange(signature, 0, 32);
        byte[] s = Arrays.copyOfRange(signature, 32, 64);
        if (new BigInteger(1, s).compareTo(HALF_CURVE_ORDER) > 0) {
            throw new VerificationException(ErrorCode.INVALID_SIGNATURE, "Non-canonical signature (high s)");
        }
        return new Sign.SignatureData(v, r, s);
    }

    public String getTrustedIssuer() {
        return trustedIssuer;
    }

    public AttestationTypedData getTypedData() {
        return typedData;
    }
}
