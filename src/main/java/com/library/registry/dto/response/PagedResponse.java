package com.library.registry.dto.response;

import java.util.List;

public record PagedResponse<T>(
    long total,
    int skip,
    int limit,
    List<T> data
) {}
