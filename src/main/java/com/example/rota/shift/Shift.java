package com.example.rota.shift;

import com.example.rota.exception.BusinessException;
import com.example.rota.exception.ErrorCategory;
import com.example.rota.exception.InvalidShiftStateException;
import com.example.rota.location.Location;
import com.example.rota.worker.Worker;
import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "shifts", indexes = {
        @Index(name = "idx_shifts_worker", columnList = "worker_id"),
        @Index(name = "idx_shifts_status", columnList = "status")
})
public class Shift {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false)
    private String role;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "shift_types", joinColumns = @JoinColumn(name = "shift_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "type_of_shift", nullable = false, length = 16)
    private Set<ShiftType> typeOfShift = new LinkedHashSet<>();

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "worker_id")
    private Worker worker;

    @Column(name = "shift_date", nullable = false)
    private LocalDate shiftDate;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "finish_time", nullable = false)
    private LocalDateTime finishTime;

    @Column(name = "num_of_shifts_per_day", nullable = false)
    private Integer numOfShiftsPerDay = 1;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "location_id")
    private Location location;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ShiftStatus status = ShiftStatus.SCHEDULED;

    @Column(name = "clock_in_time")
    private LocalDateTime clockInTime;

    @Column(name = "clock_out_time")
    private LocalDateTime clockOutTime;

    // bumped by every write, including the conditional status updates
    @Version
    private Long version;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected Shift() {
    }

    public Shift(String title,
                 String role,
                 Collection<ShiftType> typeOfShift,
                 Worker worker,
                 Location location,
                 LocalDate shiftDate,
                 ShiftTimeWindow window,
                 Integer numOfShiftsPerDay) {
        this.title = title;
        this.role = role;
        setTypeOfShift(typeOfShift);
        this.worker = worker;
        this.location = location;
        reschedule(shiftDate, window);
        this.numOfShiftsPerDay = numOfShiftsPerDay == null ? 1 : numOfShiftsPerDay;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Edits are only legal while the shift is still scheduled.
     */
    public void assertEditable() {
        if (!status.canTransitionTo(ShiftStatus.SCHEDULED)) {
            throw new InvalidShiftStateException("Cannot update shift as it is " + status.getLabel());
        }
    }

    /**
     * Refuses with the reason matching the current status unless the shift can
     * still be cancelled. The status change itself is a conditional update in
     * {@link ShiftRepository#markCancelled}.
     */
    public void assertCancellable() {
        switch (status) {
            case CANCELLED -> throw new InvalidShiftStateException("SHIFT_ALREADY_CANCELLED", "Shift is already cancelled");
            case COMPLETED -> throw new InvalidShiftStateException("SHIFT_ALREADY_COMPLETED", "Cannot cancel a completed shift");
            case IN_PROGRESS -> throw new InvalidShiftStateException("Cannot cancel a shift that is " + status.getLabel());
            case SCHEDULED -> {
            }
        }
    }

    public boolean isAssignedTo(Long workerId) {
        return worker != null && worker.getId() != null && worker.getId().equals(workerId);
    }

    public void reschedule(LocalDate shiftDate, ShiftTimeWindow window) {
        this.shiftDate = shiftDate;
        this.startTime = window.start();
        this.finishTime = window.finish();
    }

    /**
     * Checks the record as a whole before it is written.
     */
    public void validate() {
        if (title == null || title.isBlank()) {
            throw invalid("Title cannot be empty");
        }
        if (role == null || role.isBlank()) {
            throw invalid("Role cannot be empty");
        }
        if (typeOfShift == null || typeOfShift.isEmpty()) {
            throw invalid("At least one shift type is required");
        }
        if (numOfShiftsPerDay == null || numOfShiftsPerDay < 1) {
            throw invalid("Number of shifts per day must be a positive integer");
        }
        if (worker == null || location == null || shiftDate == null) {
            throw invalid("Shift requires a user, a location and a date");
        }
        if (startTime == null || finishTime == null || !finishTime.isAfter(startTime)) {
            throw invalid("Shift finish must be after its start");
        }
        if (clockInTime != null && status == ShiftStatus.SCHEDULED) {
            throw invalid("A scheduled shift cannot have a clock-in time");
        }
        if (clockOutTime != null && status != ShiftStatus.COMPLETED) {
            throw invalid("Only a completed shift can have a clock-out time");
        }
    }

    private static BusinessException invalid(String message) {
        return new BusinessException(ErrorCategory.VALIDATION_FAILURE, "VALIDATION_ERROR", message);
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public Set<ShiftType> getTypeOfShift() {
        return typeOfShift;
    }

    public void setTypeOfShift(Collection<ShiftType> types) {
        this.typeOfShift = types == null ? new LinkedHashSet<>() : new LinkedHashSet<>(types);
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public LocalDate getShiftDate() {
        return shiftDate;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getFinishTime() {
        return finishTime;
    }

    public Integer getNumOfShiftsPerDay() {
        return numOfShiftsPerDay;
    }

    public void setNumOfShiftsPerDay(Integer numOfShiftsPerDay) {
        this.numOfShiftsPerDay = numOfShiftsPerDay;
    }

    public Location getLocation() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public ShiftStatus getStatus() {
        return status;
    }

    public LocalDateTime getClockInTime() {
        return clockInTime;
    }

    public LocalDateTime getClockOutTime() {
        return clockOutTime;
    }

    public Long getVersion() {
        return version;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
