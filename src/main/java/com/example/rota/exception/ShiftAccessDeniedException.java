package com.example.rota.exception;

public class ShiftAccessDeniedException extends BusinessException {

    public ShiftAccessDeniedException() {
        super(ErrorCategory.FORBIDDEN, "UNAUTHORIZED_SHIFT_ACCESS", "You are not assigned to this shift");
    }
}
