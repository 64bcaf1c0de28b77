package com.library.registry.dto.response;

import java.util.List;

public record LibraryResponse(
    Long id,
    String name,
    List<Long> bookIds,
    List<BookSummary> books
) {}
