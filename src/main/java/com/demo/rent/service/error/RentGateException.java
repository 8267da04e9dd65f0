package com.demo.rent.service.error;

/**
 * Base of every domain failure. An operation that throws one of these has
 * persisted nothing.
 */
public abstract class RentGateException extends RuntimeException {

    private final ErrorCode code;

    protected RentGateException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected RentGateException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
