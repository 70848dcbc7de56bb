package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.codegen.dialect.AgentChordDialect;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("AgentDeclarations")
class AgentDeclarationsTest {

    @Test
    @DisplayName("numbers print without exponent or trailing zeros")
    void numberFormatting() {
        assertEquals("0.7", AgentDeclarations.formatNumber(0.7));
        assertEquals("1", AgentDeclarations.formatNumber(1.0));
        assertEquals("10", AgentDeclarations.formatNumber(10.0));
        assertEquals("0.0001", AgentDeclarations.formatNumber(0.0001));
        assertEquals("0.7", AgentDeclarations.formatNumber(Double.NaN));
    }

    @Test
    @DisplayName("indents every line and skips empty optional settings")
    void indentedDeclaration() {
        List<String> lines = AgentDeclarations.declare(new AgentChordDialect(), "  ", "bot", "Bot",
                " ", null, null, 0, "");
        assertEquals(List.of(
                "  bot = Agent(",
                "      name=\"Bot\",",
                "      role=\"AI Assistant\",",
                "      model=\"gpt-4o-mini\",",
                "      temperature=0.7,",
                "  )"), lines);
    }
}
