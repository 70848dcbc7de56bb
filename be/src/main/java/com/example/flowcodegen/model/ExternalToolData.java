package com.example.flowcodegen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A call to a tool exposed by a remote MCP server.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExternalToolData(
        String serverId,
        String serverName,
        String toolName,
        String description,
        Map<String, Object> parameters
) implements NodeData {

    public ExternalToolData {
        parameters = parameters != null ? new LinkedHashMap<>(parameters) : Map.of();
    }

    public static ExternalToolData blank() {
        return new ExternalToolData(null, null, null, null, null);
    }
}
