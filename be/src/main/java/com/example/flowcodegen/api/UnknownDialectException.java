package com.example.flowcodegen.api;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a request names a dialect that is not registered.
 * <p>
 * Mapped to HTTP 400 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class UnknownDialectException extends RuntimeException {

    private final String dialectId;
    private final List<String> availableDialects;

    public UnknownDialectException(String dialectId, List<String> availableDialects) {
        super("Unknown dialect '" + dialectId + "'; available: " + availableDialects);
        this.dialectId = dialectId;
        this.availableDialects = List.copyOf(availableDialects);
    }
}
