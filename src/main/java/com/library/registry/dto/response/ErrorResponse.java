package com.library.registry.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    String detail,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors,
    List<BulkItemError> errors
) {
    public ErrorResponse(int status, String error, String message, String detail,
                         Instant timestamp, String path) {
        this(status, error, message, detail, timestamp, path, List.of(), List.of());
    }

    public record FieldError(String field, String message) {}
}
