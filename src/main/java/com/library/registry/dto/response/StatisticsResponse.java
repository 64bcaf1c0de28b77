package com.library.registry.dto.response;

public record StatisticsResponse(
    long bookCount,
    long authorCount,
    long libraryCount,
    long totalEntities
) {}
