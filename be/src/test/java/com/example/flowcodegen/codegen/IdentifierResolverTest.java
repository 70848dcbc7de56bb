package com.example.flowcodegen.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("IdentifierResolver")
class IdentifierResolverTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
            "My Agent, my_agent",
            "camelCase, camel_case",
            "AgentA, agent_a",
            "Agent-Name-123, agent_name_123",
            "Agent1, agent1",
            "Processor_A, processor_a",
            "'Multi   space - name', multi_space_name"
    })
    @DisplayName("converts display names to snake_case")
    void snakeCase(String displayName, String expected) {
        assertEquals(expected, IdentifierResolver.resolve(displayName, 0));
    }

    @Test
    @DisplayName("blank or whitespace-only names fall back to agent_<index + 1>")
    void blankFallsBackToPosition() {
        assertEquals("agent_1", IdentifierResolver.resolve(null, 0));
        assertEquals("agent_3", IdentifierResolver.resolve("", 2));
        assertEquals("agent_5", IdentifierResolver.resolve("   ", 4));
    }

    @Test
    @DisplayName("surrounding whitespace becomes underscores like any other separator")
    void keepsEdgeWhitespace() {
        assertEquals("_my_agent", IdentifierResolver.resolve(" My Agent", 0));
        assertEquals("_writer_", IdentifierResolver.resolve("  Writer ", 0));
    }

    @Test
    @DisplayName("fallback prefix is configurable")
    void customPrefix() {
        assertEquals("member_2", IdentifierResolver.resolve(" ", 1, "member"));
    }
}
