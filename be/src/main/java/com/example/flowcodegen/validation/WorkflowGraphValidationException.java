package com.example.flowcodegen.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a submitted graph cannot be compiled as sent (duplicate ids, bad branch tags,
 * node data of the wrong shape).
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the body by {@link com.example.flowcodegen.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowGraphValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public WorkflowGraphValidationException(List<ValidationError> errors) {
        super("Workflow graph is invalid: " + (errors != null ? errors.size() : 0) + " error(s)");
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
