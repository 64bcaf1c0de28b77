package com.library.registry.mapper;

import com.library.registry.association.LinkSnapshot;
import com.library.registry.association.Relations;
import com.library.registry.dto.request.LibraryRequest;
import com.library.registry.dto.response.BookResponse;
import com.library.registry.dto.response.LibraryResponse;
import com.library.registry.entity.Library;

public final class LibraryMapper {

    private LibraryMapper() {}

    public static void updateEntity(Library library, LibraryRequest request) {
        library.setName(request.name());
    }

    public static LibraryResponse toResponse(Library library) {
        return new LibraryResponse(library.getId(), library.getName(), null, null);
    }

    public static LibraryResponse toResponse(Library library, LinkSnapshot links) {
        return new LibraryResponse(
            library.getId(),
            library.getName(),
            links.ids(Relations.LIBRARY_BOOKS),
            links.related(Relations.LIBRARY_BOOKS)
        );
    }

    public static BookResponse.LibrarySummary toSummary(Library library) {
        return new BookResponse.LibrarySummary(library.getId(), library.getName());
    }
}
