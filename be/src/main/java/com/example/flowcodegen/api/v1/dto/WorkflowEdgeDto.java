package com.example.flowcodegen.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;

/**
 * Directed edge. {@code branchTag} ("true"/"false") is only meaningful on edges leaving a condition.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowEdgeDto(
        String id,
        @NotBlank String source,
        @NotBlank String target,
        String branchTag
) {
}
