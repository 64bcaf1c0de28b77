package com.library.registry.service;

import com.library.registry.association.AssociationSynchronizer;
import com.library.registry.association.LinkSnapshot;
import com.library.registry.association.Relation;
import com.library.registry.association.Relations;
import com.library.registry.dto.request.BookRequest;
import com.library.registry.dto.response.BookResponse;
import com.library.registry.dto.response.MethodExecutionResponse;
import com.library.registry.entity.Book;
import com.library.registry.mapper.BookMapper;
import com.library.registry.repository.BookRepository;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

@Service
public class BookService extends CatalogService<Book, BookRequest, BookResponse> {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    public static final String DECREASE_STOCK = "decrease_stock";

    private final BookRepository bookRepository;

    public BookService(BookRepository bookRepository,
                       AssociationSynchronizer synchronizer,
                       RelatedEntityLoader relatedEntityLoader,
                       Validator validator) {
        super("Book", List.of(Relations.BOOK_AUTHORS, Relations.BOOK_LIBRARIES),
            bookRepository, synchronizer, relatedEntityLoader, validator);
        this.bookRepository = bookRepository;
    }

    /**
     * Removes {@code qty} items from the book's stock. The new stock is flushed before
     * returning so that a concurrent modification surfaces as an optimistic-lock conflict.
     */
    @Transactional
    public MethodExecutionResponse decreaseStock(Long id, Integer qty) {
        Book book = findEntity(id);
        book.decreaseStock(qty);
        bookRepository.saveAndFlush(book);
        log.info("Decreased stock of Book {} by {}, {} left", id, qty, book.getStock());
        return new MethodExecutionResponse(id, DECREASE_STOCK, "executed", null, null);
    }

    @Override
    protected Book newEntity() {
        return new Book();
    }

    @Override
    protected void applyFields(Book book, BookRequest request) {
        BookMapper.updateEntity(book, request);
    }

    @Override
    protected Map<Relation<?, ?>, List<Long>> relationTargets(BookRequest request) {
        return Map.of(
            Relations.BOOK_AUTHORS, orEmpty(request.authorIds()),
            Relations.BOOK_LIBRARIES, orEmpty(request.libraryIds()));
    }

    @Override
    protected BookResponse toFlatResponse(Book book) {
        return BookMapper.toResponse(book);
    }

    @Override
    protected BookResponse toResponse(Book book, LinkSnapshot links) {
        return BookMapper.toResponse(book, links);
    }
}
