package com.example.dutyroster.common;

import java.util.Collections;
import java.util.Map;

/**
 * Uniform response envelope for every roster endpoint.
 * <p>
 * Clients branch on {@code success} and read the payload from {@code data}.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
