package com.library.registry.service;

import com.library.registry.association.AssociationSynchronizer;
import com.library.registry.association.LinkSnapshot;
import com.library.registry.association.Relation;
import com.library.registry.association.Relations;
import com.library.registry.dto.request.AuthorRequest;
import com.library.registry.dto.response.AuthorResponse;
import com.library.registry.entity.Author;
import com.library.registry.exception.DomainValidationException;
import com.library.registry.mapper.AuthorMapper;
import com.library.registry.repository.AuthorRepository;
import jakarta.validation.Validator;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Authors must be created with at least one book. Later updates and unlink calls may leave
 * an author without books.
 */
@Service
public class AuthorService extends CatalogService<Author, AuthorRequest, AuthorResponse> {

    public AuthorService(AuthorRepository authorRepository,
                         AssociationSynchronizer synchronizer,
                         RelatedEntityLoader relatedEntityLoader,
                         Validator validator) {
        super("Author", List.of(Relations.AUTHOR_BOOKS),
            authorRepository, synchronizer, relatedEntityLoader, validator);
    }

    @Override
    protected void checkCreateRules(AuthorRequest request) {
        if (request.bookIds() == null || request.bookIds().isEmpty()) {
            throw new DomainValidationException("At least 1 Book(s) required");
        }
    }

    @Override
    protected Author newEntity() {
        return new Author();
    }

    @Override
    protected void applyFields(Author author, AuthorRequest request) {
        AuthorMapper.updateEntity(author, request);
    }

    @Override
    protected Map<Relation<?, ?>, List<Long>> relationTargets(AuthorRequest request) {
        return Map.of(Relations.AUTHOR_BOOKS, orEmpty(request.bookIds()));
    }

    @Override
    protected AuthorResponse toFlatResponse(Author author) {
        return AuthorMapper.toResponse(author);
    }

    @Override
    protected AuthorResponse toResponse(Author author, LinkSnapshot links) {
        return AuthorMapper.toResponse(author, links);
    }
}
