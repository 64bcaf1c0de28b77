package com.library.registry.controller;

import com.library.registry.config.PaginationProperties;
import com.library.registry.dto.request.LibraryRequest;
import com.library.registry.dto.response.LibraryResponse;
import com.library.registry.service.LibraryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/library")
@Tag(name = "Library", description = "Libraries and the books they hold")
public class LibraryController extends CatalogController<LibraryRequest, LibraryResponse> {

    public LibraryController(LibraryService libraryService, PaginationProperties pagination) {
        super(libraryService, pagination);
    }
}
