package com.library.registry.dto.response;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Book as returned by the API. Id lists are absent in flat listings; summaries are present
 * only in detailed listings.
 */
public record BookResponse(
    Long id,
    String title,
    Integer pages,
    Integer stock,
    Double price,
    LocalDate release,
    LocalTime time,
    List<Long> authorIds,
    List<Long> libraryIds,
    List<AuthorSummary> authors,
    List<LibrarySummary> libraries
) {
    public record AuthorSummary(Long id, String name) {}

    public record LibrarySummary(Long id, String name) {}
}
