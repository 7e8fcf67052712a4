package com.example.rota.shift;

import java.util.List;

/**
 * Outcome of a batch, one bucket per result kind. Each bucket keeps input order;
 * order across buckets is not preserved.
 */
public record BatchShiftResult(List<ShiftView> created, List<ShiftView> updated, List<ItemError> errors) {

    public BatchShiftResult {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
        errors = List.copyOf(errors);
    }

    public int total() {
        return created.size() + updated.size() + errors.size();
    }

    public record ItemError(int index, BatchShiftItem shift, ErrorDetail error) {}

    public record ErrorDetail(String message, String errorCode) {}
}
