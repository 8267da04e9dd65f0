package com.demo.rent.service.error;

public class ReplayException extends RentGateException {

    public ReplayException(String nullifier) {
        super(ErrorCode.NULLIFIER_USED, "Nullifier already used: " + nullifier);
    }
}
