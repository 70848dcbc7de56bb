package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowNode;

public class UnknownNodeEmitter implements NodeEmitter {

    @Override
    public NodeType supportedType() {
        return NodeType.UNKNOWN;
    }

    @Override
    public void emit(WorkflowNode node, NodeEmission out) {
        out.comment("Unknown node type: " + node.type());
    }
}
