package com.dishdash.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Success envelope for REST responses. Failures are rendered as
 * {@link org.springframework.http.ProblemDetail} by the exception handler instead.
 *
 * @param <T> payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }
}
