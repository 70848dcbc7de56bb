package com.example.flowcodegen.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Graph snapshot to compile. {@code name} names the exported file; {@code dialect} defaults
 * to the configured dialect.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerateCodeRequest(
        String name,
        String dialect,
        @NotNull @Valid List<WorkflowNodeDto> nodes,
        @NotNull @Valid List<WorkflowEdgeDto> edges
) {
}
