package com.library.registry.mapper;

import com.library.registry.association.LinkSnapshot;
import com.library.registry.association.Relations;
import com.library.registry.dto.request.AuthorRequest;
import com.library.registry.dto.response.AuthorResponse;
import com.library.registry.dto.response.BookResponse;
import com.library.registry.entity.Author;

public final class AuthorMapper {

    private AuthorMapper() {}

    public static void updateEntity(Author author, AuthorRequest request) {
        author.setName(request.name());
    }

    public static AuthorResponse toResponse(Author author) {
        return new AuthorResponse(author.getId(), author.getName(), null, null);
    }

    public static AuthorResponse toResponse(Author author, LinkSnapshot links) {
        return new AuthorResponse(
            author.getId(),
            author.getName(),
            links.ids(Relations.AUTHOR_BOOKS),
            links.related(Relations.AUTHOR_BOOKS)
        );
    }

    public static BookResponse.AuthorSummary toSummary(Author author) {
        return new BookResponse.AuthorSummary(author.getId(), author.getName());
    }
}
