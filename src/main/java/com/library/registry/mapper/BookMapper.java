package com.library.registry.mapper;

import com.library.registry.association.LinkSnapshot;
import com.library.registry.association.Relations;
import com.library.registry.dto.request.BookRequest;
import com.library.registry.dto.response.BookResponse;
import com.library.registry.dto.response.BookSummary;
import com.library.registry.entity.Book;

public final class BookMapper {

    private BookMapper() {}

    /** Full replacement of the scalar fields; relation id lists are handled by the synchronizer. */
    public static void updateEntity(Book book, BookRequest request) {
        book.setTitle(request.title());
        book.setPages(request.pages());
        book.setStock(request.stock());
        book.setPrice(request.price());
        book.setRelease(request.release());
        book.setTime(request.time());
    }

    public static BookResponse toResponse(Book book) {
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getPages(),
            book.getStock(),
            book.getPrice(),
            book.getRelease(),
            book.getTime(),
            null,
            null,
            null,
            null
        );
    }

    public static BookResponse toResponse(Book book, LinkSnapshot links) {
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getPages(),
            book.getStock(),
            book.getPrice(),
            book.getRelease(),
            book.getTime(),
            links.ids(Relations.BOOK_AUTHORS),
            links.ids(Relations.BOOK_LIBRARIES),
            links.related(Relations.BOOK_AUTHORS),
            links.related(Relations.BOOK_LIBRARIES)
        );
    }

    public static BookSummary toSummary(Book book) {
        return new BookSummary(book.getId(), book.getTitle());
    }
}
