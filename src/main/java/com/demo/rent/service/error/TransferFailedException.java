package com.demo.rent.service.error;

public class TransferFailedException extends RentGateException {

    public TransferFailedException(String message) {
        super(ErrorCode.TRANSFER_FAILED, message);
    }

    public TransferFailedException(String message, Throwable cause) {
        super(ErrorCode.TRANSFER_FAILED, message, cause);
    }
}
