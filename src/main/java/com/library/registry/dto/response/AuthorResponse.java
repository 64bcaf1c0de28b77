package com.library.registry.dto.response;

import java.util.List;

public record AuthorResponse(
    Long id,
    String name,
    List<Long> bookIds,
    List<BookSummary> books
) {}
