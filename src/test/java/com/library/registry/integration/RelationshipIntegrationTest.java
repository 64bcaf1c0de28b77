package com.library.registry.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.library.registry.dto.response.BookResponse;
import com.library.registry.dto.response.ErrorResponse;
import com.library.registry.dto.response.MessageResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipIntegrationTest extends AbstractIntegrationTest {

    private Long seedBook;
    private Long authorA;
    private Long authorB;
    private Long authorC;

    @BeforeEach
    void createAuthors() {
        seedBook = createBook("Seed");
        authorA = createAuthor("A", List.of(seedBook));
        authorB = createAuthor("B", List.of(seedBook));
        authorC = createAuthor("C", List.of(seedBook));
    }

    @Test
    void update_reconcilesAuthorsToExactTarget() {
        Long bookId = createBook("Dune", List.of(authorA, authorB), List.of());

        ResponseEntity<BookResponse> response = put(bookId, List.of(authorB, authorC));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().authorIds()).containsExactly(authorB, authorC);
        assertThat(linkedAuthorIds(bookId)).containsExactly(authorB, authorC);

        ResponseEntity<BookResponse> again = put(bookId, List.of(authorC, authorB));

        assertThat(again.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(linkedAuthorIds(bookId)).containsExactly(authorB, authorC);
    }

    @Test
    void update_withMissingAuthor_returns404AndKeepsLinksAndFields() {
        Long bookId = createBook("Dune", List.of(authorA, authorB), List.of());

        ResponseEntity<ErrorResponse> response = restTemplate.exchange(
            BOOKS_URL + bookId + "/", HttpMethod.PUT,
            new HttpEntity<>(bookRequest("Changed", 300, 5, List.of(authorB, 999_999L), List.of())),
            ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().message()).isEqualTo("Author not found with id 999999");
        assertThat(linkedAuthorIds(bookId)).containsExactly(authorA, authorB);
        assertThat(jdbcTemplate.queryForObject("SELECT title FROM books WHERE id = ?", String.class, bookId))
            .isEqualTo("Dune");
    }

    @Test
    void addAndRemoveLink_followLinkLifecycle() {
        Long bookId = createBook("Dune");
        String url = BOOKS_URL + bookId + "/authors/" + authorA + "/";

        ResponseEntity<MessageResponse> added = restTemplate.postForEntity(url, null, MessageResponse.class);
        assertThat(added.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(added.getBody().message()).isEqualTo("Author added to authors successfully");

        ResponseEntity<ErrorResponse> duplicate = restTemplate.postForEntity(url, null, ErrorResponse.class);
        assertThat(duplicate.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(linkedAuthorIds(bookId)).containsExactly(authorA);

        ResponseEntity<MessageResponse> removed =
            restTemplate.exchange(url, HttpMethod.DELETE, null, MessageResponse.class);
        assertThat(removed.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(removed.getBody().message()).isEqualTo("Author removed from authors successfully");

        ResponseEntity<ErrorResponse> removedAgain =
            restTemplate.exchange(url, HttpMethod.DELETE, null, ErrorResponse.class);
        assertThat(removedAgain.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(linkedAuthorIds(bookId)).isEmpty();
    }

    @Test
    void addLink_fromAuthorSide_isVisibleOnBook() {
        Long bookId = createBook("Dune");

        ResponseEntity<MessageResponse> added = restTemplate.postForEntity(
            AUTHORS_URL + authorC + "/books/" + bookId + "/", null, MessageResponse.class);

        assertThat(added.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(linkedAuthorIds(bookId)).containsExactly(authorC);
    }

    @Test
    void addLink_toLibrary_isVisibleOnBook() {
        Long bookId = createBook("Dune");
        Long libraryId = createLibrary("Central");

        ResponseEntity<MessageResponse> added = restTemplate.postForEntity(
            LIBRARIES_URL + libraryId + "/books/" + bookId + "/", null, MessageResponse.class);

        assertThat(added.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(linkedLibraryIds(bookId)).containsExactly(libraryId);
    }

    @Test
    void addLink_acceptsSingularLibrarySegment() {
        Long bookId = createBook("Dune");
        Long libraryId = createLibrary("Central");

        ResponseEntity<MessageResponse> added = restTemplate.postForEntity(
            BOOKS_URL + bookId + "/library/" + libraryId + "/", null, MessageResponse.class);

        assertThat(added.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(added.getBody().message()).isEqualTo("Library added to libraries successfully");
        assertThat(linkedLibraryIds(bookId)).containsExactly(libraryId);

        ResponseEntity<JsonNode> removed = restTemplate.exchange(
            BOOKS_URL + bookId + "/library/" + libraryId + "/", HttpMethod.DELETE, null, JsonNode.class);

        assertThat(removed.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(linkedLibraryIds(bookId)).isEmpty();
    }

    @Test
    void create_acceptsShortRelationKeys() {
        Long libraryId = createLibrary("Central");
        Map<String, Object> payload = Map.of(
            "title", "Dune", "pages", 412, "stock", 5, "price", 12.5,
            "release", "1965-08-01", "time", "09:15:00",
            "authors", List.of(authorA), "library", List.of(libraryId));

        ResponseEntity<BookResponse> book = restTemplate.postForEntity(BOOKS_URL, payload, BookResponse.class);

        assertThat(book.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(book.getBody().authorIds()).containsExactly(authorA);
        assertThat(book.getBody().libraryIds()).containsExactly(libraryId);

        ResponseEntity<JsonNode> author = restTemplate.postForEntity(AUTHORS_URL,
            Map.of("name", "Frank Herbert", "books", List.of(book.getBody().id())), JsonNode.class);

        assertThat(author.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(linkedAuthorIds(book.getBody().id()))
            .containsExactly(authorA, author.getBody().get("id").asLong());
    }

    @Test
    void addLink_withMissingOwnerTargetOrRelation_returns404() {
        Long bookId = createBook("Dune");

        ResponseEntity<ErrorResponse> missingOwner = restTemplate.postForEntity(
            BOOKS_URL + "999999/authors/" + authorA + "/", null, ErrorResponse.class);
        ResponseEntity<ErrorResponse> missingTarget = restTemplate.postForEntity(
            BOOKS_URL + bookId + "/authors/999999/", null, ErrorResponse.class);
        ResponseEntity<ErrorResponse> unknownRelation = restTemplate.postForEntity(
            BOOKS_URL + bookId + "/publishers/" + authorA + "/", null, ErrorResponse.class);

        assertThat(missingOwner.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(missingOwner.getBody().message()).isEqualTo("Book not found with id 999999");
        assertThat(missingTarget.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(missingTarget.getBody().message()).isEqualTo("Author not found with id 999999");
        assertThat(unknownRelation.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(linkedAuthorIds(bookId)).isEmpty();
    }

    @Test
    void listLinked_returnsSummaries() {
        Long bookId = createBook("Dune", List.of(authorB, authorA), List.of());

        ResponseEntity<JsonNode> response =
            restTemplate.getForEntity(BOOKS_URL + bookId + "/authors/", JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode body = response.getBody();
        assertThat(body.get("owner_id").asLong()).isEqualTo(bookId);
        assertThat(body.get("relation").asText()).isEqualTo("authors");
        assertThat(body.get("count").asInt()).isEqualTo(2);
        assertThat(body.get("items").get(0).get("id").asLong()).isEqualTo(authorA);
        assertThat(body.get("items").get(0).get("name").asText()).isEqualTo("A");
    }

    @Test
    void deleteAuthor_removesItsLinks() {
        Long bookId = createBook("Dune", List.of(authorA, authorB), List.of());

        ResponseEntity<JsonNode> response = restTemplate.exchange(
            AUTHORS_URL + authorA + "/", HttpMethod.DELETE, null, JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(linkedAuthorIds(bookId)).containsExactly(authorB);
        assertThat(jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM book_authors WHERE author_id = ?", Long.class, authorA)).isZero();
    }

    @Test
    void deleteBook_mayLeaveAuthorWithoutBooks() {
        Long authorOnlyOnSeed = authorA;

        restTemplate.exchange(BOOKS_URL + seedBook + "/", HttpMethod.DELETE, null, JsonNode.class);

        ResponseEntity<JsonNode> author =
            restTemplate.getForEntity(AUTHORS_URL + authorOnlyOnSeed + "/", JsonNode.class);
        assertThat(author.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(author.getBody().get("book_ids").size()).isZero();
    }

    private ResponseEntity<BookResponse> put(Long bookId, List<Long> authorIds) {
        return restTemplate.exchange(BOOKS_URL + bookId + "/", HttpMethod.PUT,
            new HttpEntity<>(bookRequest("Dune", 412, 5, authorIds, List.of())), BookResponse.class);
    }
}
