package com.library.registry.unit.service;

import com.library.registry.association.AssociationSynchronizer;
import com.library.registry.association.Relations;
import com.library.registry.dto.request.LibraryRequest;
import com.library.registry.dto.response.BookSummary;
import com.library.registry.dto.response.LibraryResponse;
import com.library.registry.entity.Library;
import com.library.registry.repository.LibraryRepository;
import com.library.registry.service.LibraryService;
import com.library.registry.service.RelatedEntityLoader;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LibraryServiceTest {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    @Mock
    private LibraryRepository libraryRepository;

    @Mock
    private AssociationSynchronizer synchronizer;

    @Mock
    private RelatedEntityLoader relatedEntityLoader;

    private LibraryService libraryService;

    @BeforeEach
    void setUp() {
        libraryService = new LibraryService(libraryRepository, synchronizer, relatedEntityLoader, VALIDATOR);
    }

    @Test
    void createLibrary_withoutBooks_isAllowed() {
        when(libraryRepository.save(any(Library.class))).thenAnswer(invocation -> {
            Library saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 4L);
            return saved;
        });

        LibraryResponse response = libraryService.create(new LibraryRequest("Central", List.of()));

        assertThat(response.id()).isEqualTo(4L);
        assertThat(response.bookIds()).isEmpty();
        verify(synchronizer).reconcile(Relations.LIBRARY_BOOKS, 4L, List.of());
    }

    @Test
    void findAll_detailed_includesBookSummariesPerLibrary() {
        Library central = createTestLibrary(1L, "Central");
        Library branch = createTestLibrary(2L, "Branch");
        when(libraryRepository.findAll(Sort.by("id"))).thenReturn(List.of(central, branch));
        when(synchronizer.listLinked(Relations.LIBRARY_BOOKS.joinTable(), List.of(1L, 2L)))
            .thenReturn(Map.of(1L, Set.of(3L), 2L, Set.of()));
        when(relatedEntityLoader.loadSummaries(Relations.LIBRARY_BOOKS, Set.of(3L)))
            .thenReturn(Map.of(3L, new BookSummary(3L, "Dune")));

        List<LibraryResponse> responses = libraryService.findAll(true);

        assertThat(responses).extracting(LibraryResponse::name).containsExactly("Central", "Branch");
        assertThat(responses.get(0).bookIds()).containsExactly(3L);
        assertThat(responses.get(0).books()).containsExactly(new BookSummary(3L, "Dune"));
        assertThat(responses.get(1).bookIds()).isEmpty();
        assertThat(responses.get(1).books()).isEmpty();
    }

    @Test
    void findAll_flat_skipsLinkLookups() {
        when(libraryRepository.findAll(Sort.by("id"))).thenReturn(List.of(createTestLibrary(1L, "Central")));

        List<LibraryResponse> responses = libraryService.findAll(false);

        assertThat(responses).hasSize(1);
        assertThat(responses.get(0).bookIds()).isNull();
        assertThat(responses.get(0).books()).isNull();
        verify(synchronizer, never()).listLinked(any(), anyCollection());
    }

    @Test
    void removeLink_delegatesToSynchronizer() {
        when(libraryRepository.existsById(1L)).thenReturn(true);

        var response = libraryService.removeLink(1L, "books", 3L);

        assertThat(response.message()).isEqualTo("Book removed from books successfully");
        verify(synchronizer).removeLink(Relations.LIBRARY_BOOKS, 1L, 3L);
    }

    private Library createTestLibrary(Long id, String name) {
        Library library = new Library();
        ReflectionTestUtils.setField(library, "id", id);
        library.setName(name);
        return library;
    }
}
