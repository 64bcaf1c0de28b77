package com.library.registry.exception;

public class DuplicateRelationshipException extends RuntimeException {

    public DuplicateRelationshipException(String relation, Long ownerId, Long otherId) {
        super("Relationship already exists: " + relation + " " + ownerId + " -> " + otherId);
    }
}
