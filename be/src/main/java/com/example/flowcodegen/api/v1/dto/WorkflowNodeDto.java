package com.example.flowcodegen.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * One node as sent by the editor. {@code data} holds the type-specific fields and is mapped
 * to a typed record before compilation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowNodeDto(
        @NotBlank String id,
        @NotBlank String type,
        Map<String, Object> data
) {
}
