package com.williamcallahan.tutormemory.web;

/**
 * Standard JSON error payload.
 *
 * @param status always "error"
 * @param message client-facing error message
 * @param details optional diagnostic details
 */
public record ApiErrorResponse(String status, String message, String details) implements ApiResponse {

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse("error", message, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse("error", message, details);
    }
}
