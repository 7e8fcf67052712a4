package com.example.rota.exception;

/**
 * Typed refusal raised by the scheduling engine.
 * <p>
 * Every refusal carries a stable machine readable {@code errorCode} next to the
 * human readable message; the category decides the HTTP outcome.
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;
    private final ErrorCategory category;

    public BusinessException(ErrorCategory category, String errorCode, String message) {
        super(message);
        this.category = category;
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
