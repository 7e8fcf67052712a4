package com.example.rota.shift;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Concrete start/finish pair of a shift.
 * <p>
 * Clock times are anchored to midnight of the shift date. A finish that is not
 * after the start belongs to the next calendar day, so {@code 22:00-06:00} on
 * 1 June ends at 06:00 on 2 June and {@code 08:00-08:00} is a 24 hour shift.
 * {@code finish} is therefore always strictly after {@code start}.
 */
public record ShiftTimeWindow(LocalDateTime start, LocalDateTime finish) {

    public static final String CLOCK_TIME_REGEX = "^([0-1]?[0-9]|2[0-3]):[0-5][0-9]$";

    private static final Pattern CLOCK_TIME = Pattern.compile(CLOCK_TIME_REGEX);
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public ShiftTimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(finish, "finish");
        if (!finish.isAfter(start)) {
            throw new IllegalArgumentException("Shift finish must be after its start");
        }
    }

    public static ShiftTimeWindow of(LocalDate date, String startTime, String finishTime) {
        Objects.requireNonNull(date, "date");
        LocalDateTime midnight = date.atStartOfDay();
        LocalDateTime start = midnight.with(parseClockTime(startTime));
        LocalDateTime finish = midnight.with(parseClockTime(finishTime));
        if (!finish.isAfter(start)) {
            finish = finish.plusDays(1);
        }
        return new ShiftTimeWindow(start, finish);
    }

    /**
     * Parses {@code H:MM} or {@code HH:MM} on a 24 hour clock.
     */
    public static LocalTime parseClockTime(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Time must be in HH:MM format");
        }
        Matcher m = CLOCK_TIME.matcher(value.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Time must be in HH:MM format: " + value);
        }
        String[] parts = value.trim().split(":");
        return LocalTime.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    }

    public static String formatClockTime(LocalDateTime value) {
        return value == null ? null : value.format(HH_MM);
    }

    public long durationMinutes() {
        return Duration.between(start, finish).toMinutes();
    }
}
