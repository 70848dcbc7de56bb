package com.example.flowcodegen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Configuration of a single agent node.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentData(
        String name,
        String role,
        String model,
        Double temperature,
        Integer maxTokens,
        String systemPrompt
) implements NodeData {

    public static AgentData blank() {
        return new AgentData(null, null, null, null, null, null);
    }
}
