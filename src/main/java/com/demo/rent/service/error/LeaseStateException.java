package com.demo.rent.service.error;

public class LeaseStateException extends RentGateException {

    public LeaseStateException(ErrorCode code, String message) {
        super(code, message);
    }
}
