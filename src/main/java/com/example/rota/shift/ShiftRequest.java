package com.example.rota.shift;

import com.example.rota.location.LocationPayload;
import jakarta.validation.Valid;
import jakarta.validation.constraints.FutureOrPresent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;
import java.util.List;

/**
 * Payload for creating a shift.
 */
public record ShiftRequest(
        @NotBlank(message = "Title cannot be empty") String title,
        @NotBlank(message = "Role cannot be empty") String role,
        @NotEmpty(message = "At least one shift type is required") List<@NotNull ShiftType> typeOfShift,
        @NotNull(message = "Invalid user ID") Long user,
        @NotNull @Pattern(regexp = ShiftTimeWindow.CLOCK_TIME_REGEX, message = "Time must be in HH:MM format") String startTime,
        @NotNull @Pattern(regexp = ShiftTimeWindow.CLOCK_TIME_REGEX, message = "Time must be in HH:MM format") String finishTime,
        @Positive(message = "Number of shifts per day must be a positive integer") Integer numOfShiftsPerDay,
        @NotNull(message = "Location is required") @Valid LocationPayload location,
        @NotNull(message = "Date is required")
        @FutureOrPresent(message = "Date cannot be in the past and must be a valid date") LocalDate date
) {
}
