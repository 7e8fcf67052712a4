package com.example.rota.shift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Descriptive tags; a shift may carry several at once.
 */
public enum ShiftType {
    WEEKEND("Weekend"),
    WEEKDAY("Weekday"),
    EVENING("Evening"),
    MORNING("Morning"),
    NIGHT("Night");

    private final String label;

    ShiftType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static ShiftType fromLabel(String value) {
        for (ShiftType type : values()) {
            if (type.label.equals(value) || type.name().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid shift type: " + value);
    }
}
