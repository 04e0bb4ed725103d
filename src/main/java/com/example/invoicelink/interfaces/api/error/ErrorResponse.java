package com.example.invoicelink.interfaces.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Error payload returned by every failing endpoint. {@code details} is omitted unless the failure
 * carries extra context, such as the accepted file extensions for a rejected upload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, Object> details
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path, null);
    }

    /**
     * @param details extra context for the caller
     * @return copy of this response carrying the details
     */
    public ErrorResponse withDetails(Map<String, Object> details) {
        return new ErrorResponse(timestamp, status, error, message, path, details);
    }
}
