package com.library.registry.service;

import com.library.registry.dto.response.HealthResponse;
import com.library.registry.dto.response.StatisticsResponse;
import com.library.registry.repository.AuthorRepository;
import com.library.registry.repository.BookRepository;
import com.library.registry.repository.LibraryRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Service
@RequiredArgsConstructor
public class SystemService {

    private static final Logger log = LoggerFactory.getLogger(SystemService.class);

    private final BookRepository bookRepository;
    private final AuthorRepository authorRepository;
    private final LibraryRepository libraryRepository;
    private final JdbcTemplate jdbcTemplate;

    @Transactional(readOnly = true)
    public StatisticsResponse statistics() {
        long books = bookRepository.count();
        long authors = authorRepository.count();
        long libraries = libraryRepository.count();
        return new StatisticsResponse(books, authors, libraries, books + authors + libraries);
    }

    /** The service reports healthy while it can answer; the database field reflects a trivial query. */
    public HealthResponse health() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return new HealthResponse("healthy", Instant.now(), "connected");
        } catch (DataAccessException ex) {
            log.warn("Database health check failed: {}", ex.getMessage());
            return new HealthResponse("healthy", Instant.now(), "unavailable");
        }
    }
}
