package com.example.rota.exception;

public class TimeWindowViolationException extends BusinessException {

    public TimeWindowViolationException(String errorCode, String message) {
        super(ErrorCategory.TIME_WINDOW_VIOLATION, errorCode, message);
    }
}
