package com.library.registry.dto.response;

import java.util.List;

public record BulkDeleteResponse(
    int deletedCount,
    List<Long> notFound,
    String message
) {}
