package com.sema.chat.dto;

import java.time.Instant;
import java.util.Map;

public record ErrorResponse(
        String error,
        String message,
        Map<String, Object> details,
        Instant timestamp,
        String requestId
) {
    public static ErrorResponse of(String error, String message, Map<String, Object> details, String requestId) {
        return new ErrorResponse(error, message, details, Instant.now(), requestId);
    }
}
