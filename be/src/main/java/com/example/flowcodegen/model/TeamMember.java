package com.example.flowcodegen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One agent inside a multi-agent team.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TeamMember(
        String name,
        String role,
        String model,
        Double temperature,
        String systemPrompt
) {
}
