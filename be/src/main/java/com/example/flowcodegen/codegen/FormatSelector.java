package com.example.flowcodegen.codegen;

import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.List;

/**
 * Picks the output shape from the node types present, ignoring topology and counts.
 */
public final class FormatSelector {

    private FormatSelector() {
    }

    public static OutputFormat select(List<WorkflowNode> nodes) {
        boolean controlFlow = nodes.stream()
                .map(WorkflowNode::kind)
                .anyMatch(NodeType.CONTROL_FLOW::contains);
        return controlFlow ? OutputFormat.PROCEDURAL : OutputFormat.CHAIN;
    }
}
