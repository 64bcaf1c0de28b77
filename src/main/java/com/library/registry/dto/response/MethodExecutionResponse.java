package com.library.registry.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record MethodExecutionResponse(
    Long bookId,
    String method,
    String status,
    String result,
    String output
) {}
