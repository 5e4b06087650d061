package com.finexec.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Status envelope for responses without a report body
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
        String status,
        String message,
        List<String> errors
) {
    public static ApiResponse success(String message) {
        return new ApiResponse("success", message, null);
    }

    public static ApiResponse error(String message, List<String> errors) {
        return new ApiResponse("error", message, errors);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse("error", message, null);
    }
}
