package com.statementprocessor.api.dto.response;

import java.time.Instant;

/**
 * Success envelope {@code {success, data, timestamp}} that {@code ApiResponseAdvice} puts around
 * processing summaries and batch results.
 */
public record ApiResponse<T>(boolean success, T data, Instant timestamp) {

    public static <T> ApiResponse<T> wrap(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
