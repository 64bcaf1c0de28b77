package com.library.registry.exception;

import com.library.registry.dto.response.BulkItemError;

import java.util.List;

public class BulkOperationException extends RuntimeException {

    private final List<BulkItemError> errors;

    public BulkOperationException(String entityName, List<BulkItemError> errors) {
        super("Bulk creation of " + entityName + " entities failed");
        this.errors = List.copyOf(errors);
    }

    public List<BulkItemError> getErrors() {
        return errors;
    }
}
