package com.example.rota.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Clock-in/clock-out buffers, in minutes.
 */
@Component
public class ShiftConstraintSettings {
    private final int earlyClockInBufferMinutes;
    private final int minimumClockOutBufferMinutes;

    public ShiftConstraintSettings(
            @Value("${rota.shift.early-clock-in-buffer-minutes:10}") int earlyClockInBufferMinutes,
            @Value("${rota.shift.minimum-clock-out-buffer-minutes:120}") int minimumClockOutBufferMinutes) {
        if (earlyClockInBufferMinutes < 0 || minimumClockOutBufferMinutes < 0) {
            throw new IllegalArgumentException("Clock buffers must not be negative");
        }
        this.earlyClockInBufferMinutes = earlyClockInBufferMinutes;
        this.minimumClockOutBufferMinutes = minimumClockOutBufferMinutes;
    }

    public int getEarlyClockInBufferMinutes() { return earlyClockInBufferMinutes; }
    public int getMinimumClockOutBufferMinutes() { return minimumClockOutBufferMinutes; }
}
