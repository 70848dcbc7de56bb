package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowNode;

/**
 * Terminates its path: edges leaving an End node are never followed.
 */
public class EndEmitter implements NodeEmitter {

    @Override
    public NodeType supportedType() {
        return NodeType.END;
    }

    @Override
    public void emit(WorkflowNode node, NodeEmission out) {
        out.comment("End node");
    }

    @Override
    public boolean continuesDownstream() {
        return false;
    }
}
