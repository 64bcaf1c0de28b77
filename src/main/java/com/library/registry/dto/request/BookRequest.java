package com.library.registry.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Body of book create and full update (PUT). Every field is replaced on update, including
 * both id lists.
 */
public record BookRequest(

    @NotBlank(message = "Title must not be blank")
    @Size(max = 100, message = "Title must not exceed 100 characters")
    String title,

    @NotNull(message = "Pages are required")
    @Min(value = 11, message = "pages must be > 10")
    Integer pages,

    @NotNull(message = "Stock is required")
    @PositiveOrZero(message = "Stock must not be negative")
    Integer stock,

    @NotNull(message = "Price is required")
    Double price,

    @NotNull(message = "Release date is required")
    LocalDate release,

    @NotNull(message = "Time is required")
    LocalTime time,

    @NotNull(message = "Author ID list must not be null")
    @JsonAlias("authors")
    List<@NotNull Long> authorIds,

    @NotNull(message = "Library ID list must not be null")
    @JsonAlias("library")
    List<@NotNull Long> libraryIds
) {}
