package com.williamcallahan.tutormemory.web;

/**
 * Common contract for status-bearing JSON payloads returned by the API.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns the status indicator for this response.
     *
     * @return "success" or "error"
     */
    String status();
}
