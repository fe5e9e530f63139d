package com.marketplace.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response envelope shared by every marketplace HTTP API.
 * Null fields are left out of the JSON body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, ErrorBody error) {

    public record ErrorBody(String code, String message) {}

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> error(String code, String message) {
        return new ApiResponse<>(false, null, new ErrorBody(code, message));
    }
}
