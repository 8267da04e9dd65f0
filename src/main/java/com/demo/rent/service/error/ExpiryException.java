package com.demo.rent.service.error;

public class ExpiryException extends RentGateException {

    public ExpiryException(ErrorCode code, String message) {
        super(code, message);
    }
}
