package com.example.rota.shift;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BatchShiftRequest(
        @NotEmpty(message = "At least one shift is required") List<@Valid BatchShiftItem> shifts
) {
}
