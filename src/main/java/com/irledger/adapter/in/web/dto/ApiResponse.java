package com.irledger.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for every JSON response of the HTTP API
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
        String status,
        String message,
        Object data
) {
    public static ApiResponse success(Object data) {
        return new ApiResponse("success", null, data);
    }

    public static ApiResponse success(String message, Object data) {
        return new ApiResponse("success", message, data);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse("error", message, null);
    }
}
