package com.example.rota.shift;

import com.example.rota.location.LocationPayload;
import jakarta.validation.Valid;
import jakarta.validation.constraints.FutureOrPresent;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

/**
 * Partial update of a scheduled shift. A {@code null} component leaves the
 * stored value untouched.
 */
public record ShiftPatch(
        @Pattern(regexp = "(?s).*\\S.*", message = "Title cannot be empty") String title,
        @Pattern(regexp = "(?s).*\\S.*", message = "Role cannot be empty") String role,
        @Size(min = 1, message = "At least one shift type is required") List<@NotNull ShiftType> typeOfShift,
        Long user,
        @Pattern(regexp = ShiftTimeWindow.CLOCK_TIME_REGEX, message = "Time must be in HH:MM format") String startTime,
        @Pattern(regexp = ShiftTimeWindow.CLOCK_TIME_REGEX, message = "Time must be in HH:MM format") String finishTime,
        @Positive(message = "Number of shifts per day must be a positive integer") Integer numOfShiftsPerDay,
        @Valid LocationPayload location,
        @FutureOrPresent(message = "Date cannot be in the past and must be a valid date") LocalDate date
) {

    public boolean touchesSchedule() {
        return date != null || startTime != null || finishTime != null;
    }
}
