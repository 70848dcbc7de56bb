package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.model.AgentData;
import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowNode;

public class AgentEmitter implements NodeEmitter {

    @Override
    public NodeType supportedType() {
        return NodeType.AGENT;
    }

    @Override
    public void emit(WorkflowNode node, NodeEmission out) {
        AgentData data = node.dataAs(AgentData.class, AgentData::blank);
        String name = data.name() != null && !data.name().isBlank() ? data.name() : "Unnamed";
        String variable = out.context().agentIdentifier(node.id());
        out.comment("Agent: " + name);
        out.line(NodeEmission.RESULT_VAR + " = " + out.dialect().awaitAgentCall(variable, out.inputVar()));
    }
}
