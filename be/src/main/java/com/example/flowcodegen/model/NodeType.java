package com.example.flowcodegen.model;

import java.util.Arrays;
import java.util.Set;

/**
 * Node types the editor can place on the canvas, keyed by their wire value.
 * Anything the editor sends that is not listed here maps to {@link #UNKNOWN}.
 */
public enum NodeType {
    TRIGGER("trigger"),
    AGENT("agent"),
    EXTERNAL_TOOL("mcp_tool"),
    CONDITION("condition"),
    PARALLEL("parallel"),
    BOUNDED_LOOP("feedback_loop"),
    TEAM("multi_agent"),
    START("start"),
    END("end"),
    UNKNOWN("unknown");

    /** Types whose presence forces the procedural output shape. */
    public static final Set<NodeType> CONTROL_FLOW = Set.of(CONDITION, PARALLEL, BOUNDED_LOOP, EXTERNAL_TOOL, TRIGGER, TEAM);

    /** Types whose generated code awaits, which makes the generated function async. */
    public static final Set<NodeType> SUSPENDING = Set.of(AGENT, EXTERNAL_TOOL, TEAM);

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static NodeType fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(t -> t != UNKNOWN && t.value.equals(value))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
