package com.library.registry.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String entityName, Long id) {
        super(entityName + " not found with id " + id);
    }

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
