package com.demo.rent.service.error;

public class ReentrancyException extends RentGateException {

    public ReentrancyException(String operation) {
        super(ErrorCode.REENTRANT_CALL, "Reentrant call rejected: " + operation);
    }
}
