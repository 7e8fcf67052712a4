package com.example.rota.exception;

public class ResourceNotFoundException extends BusinessException {

    public ResourceNotFoundException(String errorCode, String message) {
        super(ErrorCategory.NOT_FOUND, errorCode, message);
    }

    public static ResourceNotFoundException shift(Long id) {
        return new ResourceNotFoundException("SHIFT_NOT_FOUND", "Shift not found: " + id);
    }

    public static ResourceNotFoundException worker(Long id) {
        return new ResourceNotFoundException("USER_NOT_FOUND", "User not found: " + id);
    }
}
