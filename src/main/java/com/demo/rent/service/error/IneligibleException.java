package com.demo.rent.service.error;

public class IneligibleException extends RentGateException {

    public IneligibleException(ErrorCode code, String message) {
        super(code, message);
    }
}
