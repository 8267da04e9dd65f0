package com.demo.rent.service.error;

public class VerificationException extends RentGateException {

    public VerificationException(ErrorCode code, String message) {
        super(code, message);
    }

    public VerificationException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
