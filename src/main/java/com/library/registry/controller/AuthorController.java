package com.library.registry.controller;

import com.library.registry.config.PaginationProperties;
import com.library.registry.dto.request.AuthorRequest;
import com.library.registry.dto.response.AuthorResponse;
import com.library.registry.service.AuthorService;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/author")
@Tag(name = "Author", description = "Authors and their books. An author is created with at least one book.")
public class AuthorController extends CatalogController<AuthorRequest, AuthorResponse> {

    public AuthorController(AuthorService authorService, PaginationProperties pagination) {
        super(authorService, pagination);
    }
}
