package com.example.flowcodegen.codegen.dialect;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DefaultDialectRegistry")
class DefaultDialectRegistryTest {

    private final DefaultDialectRegistry registry = new DefaultDialectRegistry(JsonMapper.builder().build());

    @Test
    @DisplayName("finds generators by id ignoring case and surrounding whitespace")
    void findsById() {
        assertEquals("agentchord", registry.find("agentchord").orElseThrow().dialect().id());
        assertEquals("agentweave", registry.find(" AgentWeave ").orElseThrow().dialect().id());
    }

    @Test
    @DisplayName("returns empty for unknown or blank ids")
    void unknownIds() {
        assertTrue(registry.find("langflow").isEmpty());
        assertTrue(registry.find(" ").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    @DisplayName("lists dialects sorted by id")
    void sortedIds() {
        assertEquals(List.of("agentchord", "agentweave"), registry.getAvailableDialectIds());
        assertEquals(List.of("agentchord", "agentweave"),
                registry.getDialects().stream().map(CodeDialect::id).collect(Collectors.toList()));
    }
}
