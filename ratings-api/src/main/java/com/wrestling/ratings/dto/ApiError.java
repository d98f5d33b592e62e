package com.wrestling.ratings.dto;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 */
public record ApiError(
        String code,
        String message,
        String path,
        Instant timestamp
) {
    public ApiError(String code, String message, String path) {
        this(code, message, path, Instant.now());
    }
}
