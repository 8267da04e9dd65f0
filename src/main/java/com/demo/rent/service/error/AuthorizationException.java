package com.demo.rent.service.error;

public class AuthorizationException extends RentGateException {

    public AuthorizationException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
