package com.example.flowcodegen.model;

/**
 * Type-specific configuration carried by a {@link WorkflowNode}.
 */
public interface NodeData {
}
