package com.example.rota.shift;

import com.example.rota.location.LocationSummary;
import com.example.rota.worker.WorkerSummary;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-side rendering of a shift with its worker and location embedded and its
 * instants reduced to "HH:mm". The calendar date is returned separately.
 */
public record ShiftView(
        Long id,
        String title,
        String role,
        List<ShiftType> typeOfShift,
        String startTime,
        String finishTime,
        Integer numOfShiftsPerDay,
        LocalDate date,
        ShiftStatus status,
        String clockInTime,
        String clockOutTime,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        WorkerSummary user,
        LocationSummary location
) {

    public static ShiftView from(Shift shift) {
        return new ShiftView(
                shift.getId(),
                shift.getTitle(),
                shift.getRole(),
                List.copyOf(shift.getTypeOfShift()),
                ShiftTimeWindow.formatClockTime(shift.getStartTime()),
                ShiftTimeWindow.formatClockTime(shift.getFinishTime()),
                shift.getNumOfShiftsPerDay(),
                shift.getShiftDate(),
                shift.getStatus(),
                ShiftTimeWindow.formatClockTime(shift.getClockInTime()),
                ShiftTimeWindow.formatClockTime(shift.getClockOutTime()),
                shift.getCreatedAt(),
                shift.getUpdatedAt(),
                shift.getWorker() != null ? WorkerSummary.from(shift.getWorker()) : null,
                shift.getLocation() != null ? LocationSummary.from(shift.getLocation()) : null
        );
    }
}
