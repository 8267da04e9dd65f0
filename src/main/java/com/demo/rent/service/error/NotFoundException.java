package com.demo.rent.service.error;

public class NotFoundException extends RentGateException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
