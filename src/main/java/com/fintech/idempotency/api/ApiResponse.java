package com.fintech.idempotency.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope for every response of the API.
 *
 * {@code data} carries the business result on success or replay and is null on
 * error; {@code error} carries a human-readable detail on failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {

    private String message;
    private Object error;
    private T data;
    private String path;
    private Instant timestamp;

    public static <T> ApiResponse<T> success(String message, T data, String path) {
        return ApiResponse.<T>builder()
                .message(message)
                .data(data)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }

    public static ApiResponse<Void> failure(String message, Object error, String path) {
        return ApiResponse.<Void>builder()
                .message(message)
                .error(error)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }
}
