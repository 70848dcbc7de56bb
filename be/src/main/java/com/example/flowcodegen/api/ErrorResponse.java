package com.example.flowcodegen.api;

import com.example.flowcodegen.validation.ValidationError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body for 4xx/5xx responses; {@code errors} lists rejected fields when there are any.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, List<ValidationError> errors) {

    public ErrorResponse(String message) {
        this(message, null);
    }

    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, errors != null && !errors.isEmpty() ? List.copyOf(errors) : null);
    }
}
