package com.example.flowcodegen.codegen;

/**
 * Shape of the generated program.
 */
public enum OutputFormat {
    /** Declarative agent chain with a flow string; only for agent-only graphs. */
    CHAIN("chain"),
    /** Imperative workflow function; used as soon as any control-flow node is present. */
    PROCEDURAL("procedural");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
