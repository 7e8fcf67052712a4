package com.example.rota.common.error;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-memory ring of the latest unhandled request failures, newest first.
 */
@Component
public class ErrorLogBuffer {

    private final int capacity;
    private final Deque<Entry> entries = new ConcurrentLinkedDeque<>();

    public ErrorLogBuffer(@Value("${rota.errors.buffer-size:200}") int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("rota.errors.buffer-size must be positive");
        }
        this.capacity = capacity;
    }

    public void record(String request, Throwable failure) {
        String type = failure == null ? null : failure.getClass().getName();
        String detail = failure == null ? null : failure.getMessage();
        entries.addFirst(new Entry(LocalDateTime.now(), request, type, detail));
        while (entries.size() > capacity) {
            entries.pollLast();
        }
    }

    public List<Entry> recent(Integer limit) {
        List<Entry> snapshot = new ArrayList<>(entries);
        if (limit != null && limit > 0 && snapshot.size() > limit) {
            return List.copyOf(snapshot.subList(0, limit));
        }
        return snapshot;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public record Entry(LocalDateTime time, String request, String exception, String detail) {}
}
