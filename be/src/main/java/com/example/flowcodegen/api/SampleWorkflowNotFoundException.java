package com.example.flowcodegen.api;

import lombok.Getter;

/**
 * Thrown when a sample graph is not found by id.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class SampleWorkflowNotFoundException extends RuntimeException {

    private final String sampleId;

    public SampleWorkflowNotFoundException(String sampleId) {
        super("Sample workflow not found: " + sampleId);
        this.sampleId = sampleId;
    }
}
