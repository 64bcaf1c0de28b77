package com.library.registry.controller;

import com.library.registry.config.PaginationProperties;
import com.library.registry.dto.response.BulkCreateResponse;
import com.library.registry.dto.response.BulkDeleteResponse;
import com.library.registry.dto.response.CountResponse;
import com.library.registry.dto.response.LinkedEntitiesResponse;
import com.library.registry.dto.response.MessageResponse;
import com.library.registry.dto.response.PagedResponse;
import com.library.registry.service.CatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

/**
 * The endpoints every entity exposes. Subclasses only add the request mapping, the OpenAPI
 * tag and entity-specific methods.
 *
 * @param <Q> create/update request body
 * @param <S> response body
 */
public abstract class CatalogController<Q, S> {

    private final CatalogService<?, Q, S> service;
    private final PaginationProperties pagination;

    protected CatalogController(CatalogService<?, Q, S> service, PaginationProperties pagination) {
        this.service = service;
        this.pagination = pagination;
    }

    @GetMapping
    @Operation(summary = "List all entities", description = "Ordered by id. With detailed=true, linked entities are included inline.")
    public ResponseEntity<List<S>> findAll(@RequestParam(defaultValue = "false") boolean detailed) {
        return ResponseEntity.ok(service.findAll(detailed));
    }

    @GetMapping("/count")
    @Operation(summary = "Count entities")
    public ResponseEntity<CountResponse> count() {
        return ResponseEntity.ok(new CountResponse(service.count()));
    }

    @GetMapping("/paginated")
    @Operation(summary = "List a page of entities", description = "skip and limit must be non-negative. A skip past the end yields an empty page.")
    @ApiResponse(responseCode = "200", description = "Page returned")
    @ApiResponse(responseCode = "400", description = "Negative skip or limit")
    public ResponseEntity<PagedResponse<S>> findPage(@RequestParam(defaultValue = "0") int skip,
                                                     @RequestParam(required = false) Integer limit,
                                                     @RequestParam(defaultValue = "false") boolean detailed) {
        int pageSize = limit != null ? limit : pagination.defaultLimit();
        return ResponseEntity.ok(service.findPage(skip, pageSize, detailed));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get entity by ID", description = "Includes the ids of linked entities.")
    @ApiResponse(responseCode = "200", description = "Entity found")
    @ApiResponse(responseCode = "404", description = "Entity not found")
    public ResponseEntity<S> findById(@PathVariable Long id) {
        return ResponseEntity.ok(service.findById(id));
    }

    @PostMapping
    @Operation(summary = "Create an entity", description = "Every referenced id must exist; nothing is written otherwise.")
    @ApiResponse(responseCode = "201", description = "Entity created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Referenced entity not found")
    public ResponseEntity<S> create(@Valid @RequestBody Q request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @PostMapping("/bulk")
    @Operation(summary = "Create several entities", description = "All or nothing: any invalid item rejects the whole batch.")
    @ApiResponse(responseCode = "201", description = "All entities created")
    @ApiResponse(responseCode = "400", description = "At least one item is invalid; errors lists them by index")
    public ResponseEntity<BulkCreateResponse> bulkCreate(@RequestBody List<Q> requests) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.bulkCreate(requests));
    }

    @DeleteMapping("/bulk")
    @Operation(summary = "Delete several entities", description = "Existing ids are deleted, missing ids are reported in not_found.")
    public ResponseEntity<BulkDeleteResponse> bulkDelete(@RequestBody List<Long> ids) {
        return ResponseEntity.ok(service.bulkDelete(ids));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Replace an entity", description = "Full update: scalar fields and linked id lists are replaced.")
    @ApiResponse(responseCode = "200", description = "Entity updated")
    @ApiResponse(responseCode = "404", description = "Entity or referenced entity not found")
    public ResponseEntity<S> update(@PathVariable Long id, @Valid @RequestBody Q request) {
        return ResponseEntity.ok(service.update(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an entity", description = "Returns the deleted entity. Its links are removed as well.")
    @ApiResponse(responseCode = "200", description = "Entity deleted")
    @ApiResponse(responseCode = "404", description = "Entity not found")
    public ResponseEntity<S> delete(@PathVariable Long id) {
        return ResponseEntity.ok(service.delete(id));
    }

    @PostMapping("/{id}/{relation}/{otherId}")
    @Operation(summary = "Link an entity")
    @ApiResponse(responseCode = "201", description = "Link created")
    @ApiResponse(responseCode = "404", description = "Entity, linked entity or relation not found")
    @ApiResponse(responseCode = "409", description = "Already linked")
    public ResponseEntity<MessageResponse> addLink(@PathVariable Long id,
                                                   @PathVariable String relation,
                                                   @PathVariable Long otherId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.addLink(id, relation, otherId));
    }

    @DeleteMapping("/{id}/{relation}/{otherId}")
    @Operation(summary = "Unlink an entity")
    @ApiResponse(responseCode = "200", description = "Link removed")
    @ApiResponse(responseCode = "404", description = "Entity, relation or link not found")
    public ResponseEntity<MessageResponse> removeLink(@PathVariable Long id,
                                                      @PathVariable String relation,
                                                      @PathVariable Long otherId) {
        return ResponseEntity.ok(service.removeLink(id, relation, otherId));
    }

    @GetMapping("/{id}/{relation}")
    @Operation(summary = "List linked entities")
    @ApiResponse(responseCode = "404", description = "Entity or relation not found")
    public ResponseEntity<LinkedEntitiesResponse<?>> listLinked(@PathVariable Long id,
                                                                @PathVariable String relation) {
        return ResponseEntity.ok(service.listLinked(id, relation));
    }
}
