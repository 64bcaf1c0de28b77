package com.library.registry.association;

import com.library.registry.dto.response.BookResponse;
import com.library.registry.dto.response.BookSummary;
import com.library.registry.entity.Author;
import com.library.registry.entity.Book;
import com.library.registry.entity.Library;
import com.library.registry.mapper.AuthorMapper;
import com.library.registry.mapper.BookMapper;
import com.library.registry.mapper.LibraryMapper;

import java.util.Set;

/**
 * The two join tables of the schema, each configured once per owning side.
 */
public final class Relations {

    public static final Relation<Author, BookResponse.AuthorSummary> BOOK_AUTHORS = new Relation<>(
        "authors", "Author", Author.class,
        new JoinTableMapping("book_authors", "book_id", "author_id", "authors"),
        AuthorMapper::toSummary);

    public static final Relation<Library, BookResponse.LibrarySummary> BOOK_LIBRARIES = new Relation<>(
        "libraries", "Library", Library.class,
        new JoinTableMapping("book_libraries", "book_id", "library_id", "libraries"),
        LibraryMapper::toSummary,
        Set.of("library"));

    public static final Relation<Book, BookSummary> AUTHOR_BOOKS = new Relation<>(
        "books", "Book", Book.class,
        BOOK_AUTHORS.joinTable().inverse("books"),
        BookMapper::toSummary);

    public static final Relation<Book, BookSummary> LIBRARY_BOOKS = new Relation<>(
        "books", "Book", Book.class,
        BOOK_LIBRARIES.joinTable().inverse("books"),
        BookMapper::toSummary);

    private Relations() {}
}
