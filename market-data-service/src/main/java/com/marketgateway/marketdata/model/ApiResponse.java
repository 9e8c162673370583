package com.marketgateway.marketdata.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for every REST response: {@code {ok, result}} or {@code {ok, error: {code, message}}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean ok, T result, ApiError error) {

    public record ApiError(String code, String message) {}

    public static <T> ApiResponse<T> success(T result) {
        return new ApiResponse<>(true, result, null);
    }

    public static <T> ApiResponse<T> failure(String code, String message) {
        return new ApiResponse<>(false, null, new ApiError(code, message));
    }
}
