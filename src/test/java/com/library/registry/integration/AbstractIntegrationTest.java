package com.library.registry.integration;

import com.library.registry.dto.request.AuthorRequest;
import com.library.registry.dto.request.BookRequest;
import com.library.registry.dto.request.LibraryRequest;
import com.library.registry.dto.response.AuthorResponse;
import com.library.registry.dto.response.BookResponse;
import com.library.registry.dto.response.LibraryResponse;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the application on a random port against the in-memory H2 database configured in
 * the test {@code application.yml}. Flyway builds the schema once; every table is emptied
 * before each test.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public abstract class AbstractIntegrationTest {

    protected static final String BOOKS_URL = "/book/";
    protected static final String AUTHORS_URL = "/author/";
    protected static final String LIBRARIES_URL = "/library/";

    @Autowired
    protected TestRestTemplate restTemplate;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    protected void cleanDatabase() {
        jdbcTemplate.update("DELETE FROM book_authors");
        jdbcTemplate.update("DELETE FROM book_libraries");
        jdbcTemplate.update("DELETE FROM books");
        jdbcTemplate.update("DELETE FROM authors");
        jdbcTemplate.update("DELETE FROM libraries");
    }

    protected static BookRequest bookRequest(String title, int pages, int stock,
                                             List<Long> authorIds, List<Long> libraryIds) {
        return new BookRequest(title, pages, stock, 12.5, LocalDate.of(1965, 8, 1),
            LocalTime.of(9, 15), authorIds, libraryIds);
    }

    protected Long createBook(String title) {
        return createBook(title, List.of(), List.of());
    }

    protected Long createBook(String title, List<Long> authorIds, List<Long> libraryIds) {
        ResponseEntity<BookResponse> response = restTemplate.postForEntity(BOOKS_URL,
            bookRequest(title, 300, 5, authorIds, libraryIds), BookResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().id();
    }

    protected Long createAuthor(String name, List<Long> bookIds) {
        ResponseEntity<AuthorResponse> response = restTemplate.postForEntity(AUTHORS_URL,
            new AuthorRequest(name, bookIds), AuthorResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().id();
    }

    protected Long createLibrary(String name) {
        ResponseEntity<LibraryResponse> response = restTemplate.postForEntity(LIBRARIES_URL,
            new LibraryRequest(name, List.of()), LibraryResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().id();
    }

    protected List<Long> linkedAuthorIds(Long bookId) {
        return jdbcTemplate.queryForList(
            "SELECT author_id FROM book_authors WHERE book_id = ? ORDER BY author_id", Long.class, bookId);
    }

    protected List<Long> linkedLibraryIds(Long bookId) {
        return jdbcTemplate.queryForList(
            "SELECT library_id FROM book_libraries WHERE book_id = ? ORDER BY library_id", Long.class, bookId);
    }
}
