package com.demo.rent.service.error;

public enum ErrorCode {
    INVALID_DEADLINE,
    INVALID_TERMS,
    INVALID_ADDRESS,
    AMOUNT_MISMATCH,
    PARAMETER_MISMATCH,
    UNAUTHORIZED,
    NOT_FOUND,
    NULLIFIER_USED,
    ALREADY_ACTIVE,
    NOT_ACTIVE,
    TOO_EARLY,
    POLICY_EXPIRED,
    CLAIM_EXPIRED,
    INELIGIBLE,
    NOT_ELIGIBLE,
    VERIFICATION_FAILED,
    INVALID_SIGNATURE,
    VERIFIER_UNAVAILABLE,
    REENTRANT_CALL,
    TRANSFER_FAILED
}
