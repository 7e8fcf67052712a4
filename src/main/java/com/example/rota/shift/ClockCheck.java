package com.example.rota.shift;

/**
 * Outcome of a clock-in or clock-out window check.
 */
public record ClockCheck(boolean valid, String errorCode, String message) {

    static ClockCheck ok(String message) {
        return new ClockCheck(true, null, message);
    }

    static ClockCheck fail(String errorCode, String message) {
        return new ClockCheck(false, errorCode, message);
    }
}
