package com.agrivision.ingestion.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned to devices: {@code {"error": "..."}}, plus {@code details} for server-side
 * failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error")
    String error,

    @JsonProperty("details")
    String details
) {
    public static final String SERVER_ERROR = "Server error";

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }

    public static ErrorResponse of(String error, String details) {
        return new ErrorResponse(error, details);
    }
}
