package com.library.registry.dto.response;

import java.util.List;

public record BulkCreateResponse(
    int createdCount,
    List<Long> createdIds,
    String message
) {}
