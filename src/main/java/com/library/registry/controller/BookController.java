package com.library.registry.controller;

import com.library.registry.config.PaginationProperties;
import com.library.registry.dto.request.BookRequest;
import com.library.registry.dto.request.DecreaseStockRequest;
import com.library.registry.dto.response.BookResponse;
import com.library.registry.dto.response.MethodExecutionResponse;
import com.library.registry.service.BookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/book")
@Tag(name = "Book", description = "Books and their authors and libraries")
public class BookController extends CatalogController<BookRequest, BookResponse> {

    private final BookService bookService;

    public BookController(BookService bookService, PaginationProperties pagination) {
        super(bookService, pagination);
        this.bookService = bookService;
    }

    @PostMapping("/{id}/methods/decrease_stock")
    @Operation(summary = "Decrease stock", description = "Body: {\"params\": {\"qty\": n}}. qty must be positive and not exceed the current stock.")
    @ApiResponse(responseCode = "200", description = "Stock decreased")
    @ApiResponse(responseCode = "400", description = "Invalid quantity or insufficient stock")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "409", description = "Book was modified concurrently")
    public ResponseEntity<MethodExecutionResponse> decreaseStock(@PathVariable Long id,
                                                                 @Valid @RequestBody DecreaseStockRequest request) {
        return ResponseEntity.ok(bookService.decreaseStock(id, request.params().qty()));
    }
}
