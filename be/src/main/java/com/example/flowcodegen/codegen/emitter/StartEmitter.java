package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowNode;

public class StartEmitter implements NodeEmitter {

    @Override
    public NodeType supportedType() {
        return NodeType.START;
    }

    @Override
    public void emit(WorkflowNode node, NodeEmission out) {
        out.comment("Start node");
    }
}
