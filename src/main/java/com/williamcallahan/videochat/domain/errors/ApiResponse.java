package com.williamcallahan.videochat.domain.errors;

/**
 * Shared contract for the JSON status payloads returned by non-streaming endpoints.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns the status indicator for this response.
     *
     * @return {@code "success"} or {@code "error"}
     */
    String status();
}
