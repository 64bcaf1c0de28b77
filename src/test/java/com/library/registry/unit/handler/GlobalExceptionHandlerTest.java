package com.library.registry.unit.handler;

import com.library.registry.controller.handler.GlobalExceptionHandler;
import com.library.registry.dto.response.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void duplicateKey_returns409ConflictEnvelope() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/book/1/authors/2/");

        ResponseEntity<ErrorResponse> response = handler.handleDuplicateKey(
            new DuplicateKeyException("duplicate key value violates unique constraint \"book_authors_pkey\""),
            request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        ErrorResponse body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.status()).isEqualTo(409);
        assertThat(body.error()).isEqualTo("Conflict");
        assertThat(body.message()).isEqualTo("Relationship already exists");
        assertThat(body.detail()).isEqualTo("The entities are already linked");
        assertThat(body.path()).isEqualTo("/book/1/authors/2/");
        assertThat(body.timestamp()).isNotNull();
    }

    @Test
    void unexpectedError_returns500WithDetail() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/book/1/");

        ResponseEntity<ErrorResponse> response = handler.handleGeneral(new IllegalStateException("boom"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).isEqualTo("An unexpected error occurred");
        assertThat(response.getBody().detail()).isEqualTo("Internal server error");
        assertThat(response.getBody().path()).isEqualTo("/book/1/");
    }

    @Test
    void databaseError_returns500WithDetail() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/statistics");

        ResponseEntity<ErrorResponse> response = handler.handleDataAccess(
            new QueryTimeoutException("statement timeout"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).isEqualTo("Database operation failed");
        assertThat(response.getBody().detail()).isNotBlank();
    }

    @Test
    void illegalArgument_returns400WithDetail() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/book/paginated/");

        ResponseEntity<ErrorResponse> response = handler.handleIllegalArgument(
            new IllegalArgumentException("skip must be a non-negative integer"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().message()).isEqualTo("skip must be a non-negative integer");
        assertThat(response.getBody().detail()).isEqualTo("Invalid input data provided");
    }
}
