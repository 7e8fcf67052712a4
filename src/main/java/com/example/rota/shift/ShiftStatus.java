package com.example.rota.shift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a shift.
 * <pre>
 * Scheduled --clock-in--> In Progress --clock-out--> Completed
 * Scheduled --cancel----> Cancelled
 * </pre>
 * Completed and Cancelled are terminal.
 */
public enum ShiftStatus {
    SCHEDULED("Scheduled"),
    IN_PROGRESS("In Progress"),
    COMPLETED("Completed"),
    CANCELLED("Cancelled");

    private final String label;

    ShiftStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean canTransitionTo(ShiftStatus target) {
        return switch (this) {
            case SCHEDULED -> target == SCHEDULED || target == IN_PROGRESS || target == CANCELLED;
            case IN_PROGRESS -> target == COMPLETED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    /**
     * Accepts the display label ("In Progress") or the constant name ("IN_PROGRESS").
     */
    @JsonCreator
    public static ShiftStatus fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Shift status is required");
        }
        String v = value.trim();
        for (ShiftStatus status : values()) {
            if (status.label.equalsIgnoreCase(v) || status.name().equalsIgnoreCase(v)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid shift status: " + value);
    }
}
