package com.example.flowcodegen.validation;

import java.util.Objects;

/**
 * One rejected field of a graph request, e.g. {@code nodes[a].id}.
 */
public record ValidationError(String field, String message) {

    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }

    public static ValidationError of(String field, String message) {
        return new ValidationError(field, message);
    }
}
