package com.example.rota.common;

import java.util.Collections;
import java.util.Map;

/**
 * Response envelope shared by every endpoint.
 * <p>
 * Clients rely on the {@code success} flag and read the payload from {@code data}.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
