package com.demo.rent.service.error;

public class ValidationException extends RentGateException {

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
