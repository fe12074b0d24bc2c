package dev.shelfscan.inventory.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope returned by the inventory API: {@code { success, data }} or {@code { success: false, error }}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String error) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> failure(String error) {
        return new ApiResponse<>(false, null, error);
    }
}
