package com.example.rota.exception;

public class InvalidShiftStateException extends BusinessException {

    public InvalidShiftStateException(String errorCode, String message) {
        super(ErrorCategory.INVALID_STATE, errorCode, message);
    }

    public InvalidShiftStateException(String message) {
        this("INVALID_SHIFT_STATUS", message);
    }
}
