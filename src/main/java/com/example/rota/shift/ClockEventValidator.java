package com.example.rota.shift;

import com.example.rota.config.ShiftConstraintSettings;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Decides whether a worker may clock in or out at a given instant.
 * <ul>
 *   <li>clock-in: {@code start - earlyBuffer <= now <= finish}</li>
 *   <li>clock-out: {@code now >= finish - minimumBuffer}, no upper bound</li>
 * </ul>
 * A shift no longer than the clock-out buffer minus the early clock-in buffer
 * (110 minutes with the defaults) can be clocked out of as soon as it has been
 * clocked into, even at the earliest clock-in instant.
 */
@Component
public class ClockEventValidator {

    public static final String CLOCK_IN_TOO_EARLY = "CLOCK_IN_TOO_EARLY";
    public static final String SHIFT_TIME_EXPIRED = "SHIFT_TIME_EXPIRED";
    public static final String CLOCK_OUT_TOO_EARLY = "CLOCK_OUT_TOO_EARLY";

    private final ShiftConstraintSettings settings;

    public ClockEventValidator(ShiftConstraintSettings settings) {
        this.settings = settings;
    }

    public ClockCheck checkClockIn(LocalDateTime now, LocalDateTime start, LocalDateTime finish) {
        int buffer = settings.getEarlyClockInBufferMinutes();
        LocalDateTime earliest = start.minusMinutes(buffer);
        if (now.isBefore(earliest)) {
            return ClockCheck.fail(CLOCK_IN_TOO_EARLY, String.format(
                    "Cannot clock in more than %d minutes before shift starts (%d minutes too early)",
                    buffer, minutesBetween(now, earliest)));
        }
        if (now.isAfter(finish)) {
            return ClockCheck.fail(SHIFT_TIME_EXPIRED, String.format(
                    "Cannot clock in after shift end time (shift ended %d minutes ago)",
                    minutesBetween(finish, now)));
        }
        return ClockCheck.ok("Clock-in time is valid");
    }

    public ClockCheck checkClockOut(LocalDateTime now, LocalDateTime finish) {
        int buffer = settings.getMinimumClockOutBufferMinutes();
        LocalDateTime earliest = finish.minusMinutes(buffer);
        if (now.isBefore(earliest)) {
            return ClockCheck.fail(CLOCK_OUT_TOO_EARLY, String.format(
                    "Cannot clock out more than %d minutes before shift ends (%d minutes too early)",
                    buffer, minutesBetween(now, earliest)));
        }
        return ClockCheck.ok("Clock-out time is valid");
    }

    // rounded up so a violation never reports zero minutes
    private static long minutesBetween(LocalDateTime from, LocalDateTime to) {
        long seconds = Duration.between(from, to).getSeconds();
        return (seconds + 59) / 60;
    }
}
