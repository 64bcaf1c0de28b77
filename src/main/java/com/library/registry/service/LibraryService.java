package com.library.registry.service;

import com.library.registry.association.AssociationSynchronizer;
import com.library.registry.association.LinkSnapshot;
import com.library.registry.association.Relation;
import com.library.registry.association.Relations;
import com.library.registry.dto.request.LibraryRequest;
import com.library.registry.dto.response.LibraryResponse;
import com.library.registry.entity.Library;
import com.library.registry.mapper.LibraryMapper;
import com.library.registry.repository.LibraryRepository;
import jakarta.validation.Validator;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class LibraryService extends CatalogService<Library, LibraryRequest, LibraryResponse> {

    public LibraryService(LibraryRepository libraryRepository,
                          AssociationSynchronizer synchronizer,
                          RelatedEntityLoader relatedEntityLoader,
                          Validator validator) {
        super("Library", List.of(Relations.LIBRARY_BOOKS),
            libraryRepository, synchronizer, relatedEntityLoader, validator);
    }

    @Override
    protected Library newEntity() {
        return new Library();
    }

    @Override
    protected void applyFields(Library library, LibraryRequest request) {
        LibraryMapper.updateEntity(library, request);
    }

    @Override
    protected Map<Relation<?, ?>, List<Long>> relationTargets(LibraryRequest request) {
        return Map.of(Relations.LIBRARY_BOOKS, orEmpty(request.bookIds()));
    }

    @Override
    protected LibraryResponse toFlatResponse(Library library) {
        return LibraryMapper.toResponse(library);
    }

    @Override
    protected LibraryResponse toResponse(Library library, LinkSnapshot links) {
        return LibraryMapper.toResponse(library, links);
    }
}
