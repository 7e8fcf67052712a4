package com.example.rota.shift;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

public record ClockEventResult(String message, ShiftClockState shift) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ShiftClockState(Long id, ShiftStatus status, String clockInTime, String clockOutTime) {}

    static ClockEventResult clockedIn(Long id, LocalDateTime at) {
        return new ClockEventResult("Successfully clocked in",
                new ShiftClockState(id, ShiftStatus.IN_PROGRESS, ShiftTimeWindow.formatClockTime(at), null));
    }

    static ClockEventResult clockedOut(Long id, LocalDateTime at) {
        return new ClockEventResult("Successfully clocked out",
                new ShiftClockState(id, ShiftStatus.COMPLETED, null, ShiftTimeWindow.formatClockTime(at)));
    }
}
