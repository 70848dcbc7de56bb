package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowNode;

/**
 * Emission strategy for one node type.
 */
public interface NodeEmitter {

    NodeType supportedType();

    void emit(WorkflowNode node, NodeEmission out);

    /**
     * Whether the walker should continue into every outgoing edge after this node.
     * Emitters that route to their own children (branches, fan-out, loops) or end a path return {@code false}.
     */
    default boolean continuesDownstream() {
        return true;
    }
}
