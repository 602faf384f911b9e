package com.williamcallahan.tutormemory.web;

/**
 * Standard JSON success payload for operations without a result body.
 *
 * @param status always "success"
 * @param message client-facing message
 */
public record ApiSuccessResponse(String status, String message) implements ApiResponse {

    public static ApiSuccessResponse success(String message) {
        return new ApiSuccessResponse("success", message);
    }
}
