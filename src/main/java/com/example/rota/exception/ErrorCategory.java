package com.example.rota.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCategory {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_STATE(HttpStatus.CONFLICT),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    TIME_WINDOW_VIOLATION(HttpStatus.BAD_REQUEST),
    VALIDATION_FAILURE(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    ErrorCategory(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
