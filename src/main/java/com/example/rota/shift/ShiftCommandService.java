package com.example.rota.shift;

import com.example.rota.exception.InvalidShiftStateException;
import com.example.rota.exception.ResourceNotFoundException;
import com.example.rota.exception.ShiftAccessDeniedException;
import com.example.rota.exception.TimeWindowViolationException;
import com.example.rota.location.Location;
import com.example.rota.location.LocationService;
import com.example.rota.worker.Worker;
import com.example.rota.worker.WorkerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Write side of the shift lifecycle: create, edit, delete, cancel and the
 * worker's clock-in/clock-out.
 */
@Service
@Transactional
public class ShiftCommandService {

    private static final Logger logger = LoggerFactory.getLogger(ShiftCommandService.class);

    private final ShiftRepository shiftRepository;
    private final WorkerService workerService;
    private final LocationService locationService;
    private final ClockEventValidator clockEventValidator;
    private final Clock clock;

    public ShiftCommandService(ShiftRepository shiftRepository,
                               WorkerService workerService,
                               LocationService locationService,
                               ClockEventValidator clockEventValidator,
                               Clock clock) {
        this.shiftRepository = shiftRepository;
        this.workerService = workerService;
        this.locationService = locationService;
        this.clockEventValidator = clockEventValidator;
        this.clock = clock;
    }

    public ShiftView create(ShiftRequest request) {
        Worker worker = workerService.requireWorker(request.user());
        Location location = locationService.findOrCreate(request.location());
        ShiftTimeWindow window = ShiftTimeWindow.of(request.date(), request.startTime(), request.finishTime());

        Shift shift = new Shift(
                request.title().trim(),
                request.role().trim(),
                request.typeOfShift(),
                worker,
                location,
                request.date(),
                window,
                request.numOfShiftsPerDay()
        );
        shift.validate();
        Shift saved = shiftRepository.save(shift);

        logger.info("Created shift: ID={}, date={}, worker={}, {}-{}",
                saved.getId(), saved.getShiftDate(), worker.getName(),
                ShiftTimeWindow.formatClockTime(saved.getStartTime()),
                ShiftTimeWindow.formatClockTime(saved.getFinishTime()));
        return ShiftView.from(saved);
    }

    /**
     * Applies the supplied fields of {@code patch} to a scheduled shift. When any
     * of date, start or finish is given the instant pair is recomputed, taking
     * the missing parts from the stored shift. The write is checked against the
     * version read, so a clock-in or cancel committed in between makes it fail
     * with {@code INVALID_SHIFT_STATUS} instead of overwriting that change.
     */
    public ShiftView update(Long shiftId, ShiftPatch patch) {
        Shift shift = requireShift(shiftId);
        shift.assertEditable();

        if (patch.user() != null) {
            shift.setWorker(workerService.requireWorker(patch.user()));
        }
        if (patch.location() != null) {
            shift.setLocation(locationService.findOrCreate(patch.location()));
        }
        if (patch.touchesSchedule()) {
            LocalDate date = patch.date() != null ? patch.date() : shift.getShiftDate();
            String start = patch.startTime() != null
                    ? patch.startTime()
                    : ShiftTimeWindow.formatClockTime(shift.getStartTime());
            String finish = patch.finishTime() != null
                    ? patch.finishTime()
                    : ShiftTimeWindow.formatClockTime(shift.getFinishTime());
            shift.reschedule(date, ShiftTimeWindow.of(date, start, finish));
        }
        if (patch.title() != null) {
            shift.setTitle(patch.title().trim());
        }
        if (patch.role() != null) {
            shift.setRole(patch.role().trim());
        }
        if (patch.typeOfShift() != null) {
            shift.setTypeOfShift(patch.typeOfShift());
        }
        if (patch.numOfShiftsPerDay() != null) {
            shift.setNumOfShiftsPerDay(patch.numOfShiftsPerDay());
        }

        shift.validate();
        Shift saved;
        try {
            saved = shiftRepository.saveAndFlush(shift);
        } catch (OptimisticLockingFailureException e) {
            logger.warn("Shift {} changed while being updated", shiftId);
            throw new InvalidShiftStateException("Cannot update shift as it was changed by another request");
        }

        logger.info("Updated shift: ID={}", saved.getId());
        return ShiftView.from(saved);
    }

    public void delete(Long shiftId) {
        Shift shift = requireShift(shiftId);
        shiftRepository.delete(shift);
        logger.info("Deleted shift: ID={}, status={}", shiftId, shift.getStatus().getLabel());
    }

    public void cancel(Long shiftId) {
        requireShift(shiftId).assertCancellable();

        int updated = shiftRepository.markCancelled(shiftId, ShiftStatus.SCHEDULED, ShiftStatus.CANCELLED,
                LocalDateTime.now(clock));
        if (updated == 0) {
            // moved on since the read; report the reason for its current status
            requireShift(shiftId).assertCancellable();
            throw new InvalidShiftStateException("Shift is no longer scheduled");
        }
        logger.info("Cancelled shift: ID={}", shiftId);
    }

    public ClockEventResult clockIn(Long shiftId, Long workerId) {
        Shift shift = requireShift(shiftId);
        if (!shift.isAssignedTo(workerId)) {
            throw new ShiftAccessDeniedException();
        }
        if (!shift.getStatus().canTransitionTo(ShiftStatus.IN_PROGRESS)) {
            throw new InvalidShiftStateException("Can only clock in to scheduled shifts");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        ClockCheck check = clockEventValidator.checkClockIn(now, shift.getStartTime(), shift.getFinishTime());
        if (!check.valid()) {
            throw new TimeWindowViolationException(check.errorCode(), check.message());
        }

        int updated = shiftRepository.markClockedIn(shiftId, ShiftStatus.SCHEDULED, ShiftStatus.IN_PROGRESS, now);
        if (updated == 0) {
            throw new InvalidShiftStateException("Can only clock in to scheduled shifts");
        }

        logger.info("Worker {} clocked in to shift {} at {}", workerId, shiftId, now);
        return ClockEventResult.clockedIn(shiftId, now);
    }

    public ClockEventResult clockOut(Long shiftId, Long workerId) {
        Shift shift = requireShift(shiftId);
        if (!shift.isAssignedTo(workerId)) {
            throw new ShiftAccessDeniedException();
        }
        if (!shift.getStatus().canTransitionTo(ShiftStatus.COMPLETED)) {
            throw new InvalidShiftStateException("Can only clock out from shifts in progress");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        ClockCheck check = clockEventValidator.checkClockOut(now, shift.getFinishTime());
        if (!check.valid()) {
            throw new TimeWindowViolationException(check.errorCode(), check.message());
        }

        int updated = shiftRepository.markClockedOut(shiftId, ShiftStatus.IN_PROGRESS, ShiftStatus.COMPLETED, now);
        if (updated == 0) {
            throw new InvalidShiftStateException("Can only clock out from shifts in progress");
        }

        logger.info("Worker {} clocked out of shift {} at {}", workerId, shiftId, now);
        return ClockEventResult.clockedOut(shiftId, now);
    }

    private Shift requireShift(Long shiftId) {
        return shiftRepository.findById(shiftId)
                .orElseThrow(() -> ResourceNotFoundException.shift(shiftId));
    }
}
