package com.library.registry.exception;

/**
 * A request that is well-formed but violates a business rule, such as an author without
 * books or a stock decrement larger than the available stock. Mapped to 400.
 */
public class DomainValidationException extends RuntimeException {

    public DomainValidationException(String message) {
        super(message);
    }
}
