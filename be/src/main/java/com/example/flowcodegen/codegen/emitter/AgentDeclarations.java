package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.codegen.dialect.CodeDialect;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@code x = Agent(...)} declarations, shared by the hoisted agent section and
 * the inline members of a team.
 */
public final class AgentDeclarations {

    public static final String DEFAULT_ROLE = "AI Assistant";
    public static final String DEFAULT_MODEL = "gpt-4o-mini";
    public static final double DEFAULT_TEMPERATURE = 0.7;

    private AgentDeclarations() {
    }

    public static List<String> declare(
            CodeDialect dialect,
            String indent,
            String variable,
            String displayName,
            String role,
            String model,
            Double temperature,
            Integer maxTokens,
            String systemPrompt
    ) {
        String inner = indent + CodeDialect.INDENT;
        List<String> lines = new ArrayList<>();
        lines.add(indent + variable + " = Agent(");
        lines.add(inner + "name=" + dialect.stringLiteral(displayName) + ",");
        lines.add(inner + "role=" + dialect.stringLiteral(orDefault(role, DEFAULT_ROLE)) + ",");
        lines.add(inner + "model=" + dialect.stringLiteral(orDefault(model, DEFAULT_MODEL)) + ",");
        lines.add(inner + "temperature=" + formatNumber(temperature != null ? temperature : DEFAULT_TEMPERATURE) + ",");
        if (maxTokens != null && maxTokens > 0) {
            lines.add(inner + "max_tokens=" + maxTokens + ",");
        }
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            lines.add(inner + "system_prompt=" + dialect.tripleQuotedLiteral(systemPrompt) + ",");
        }
        lines.add(indent + ")");
        return lines;
    }

    /** Python float literal: {@code 0.7}, {@code 1}, never exponent notation. */
    static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return formatNumber(DEFAULT_TEMPERATURE);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
