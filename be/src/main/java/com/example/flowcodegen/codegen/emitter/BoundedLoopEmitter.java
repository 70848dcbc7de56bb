package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.codegen.dialect.CodeDialect;
import com.example.flowcodegen.model.LoopData;
import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.List;

/**
 * Lowers a feedback loop to a bounded {@code for} loop. The body is the target of the first
 * outgoing edge; further edges are ignored.
 */
public class BoundedLoopEmitter implements NodeEmitter {

    static final String LOOP_VAR = "loop_result";

    @Override
    public NodeType supportedType() {
        return NodeType.BOUNDED_LOOP;
    }

    @Override
    public void emit(WorkflowNode node, NodeEmission out) {
        TraversalContext context = out.context();
        LoopData data = node.dataAs(LoopData.class, LoopData::blank);
        int maxIterations = data.maxIterations() != null && data.maxIterations() > 0 ? data.maxIterations() : 1;
        String stop = data.stopCondition() != null && !data.stopCondition().isBlank()
                ? data.stopCondition().trim()
                : ConditionEmitter.FALLBACK_EXPRESSION;
        List<WorkflowEdge> edges = context.outgoing(context.slotOf(node.id()).orElseThrow());

        out.comment("Feedback loop (max " + maxIterations + " iterations, stop: " + stop + ")");
        out.line(LOOP_VAR + " = " + out.inputVar());
        out.line("for _iteration in range(" + maxIterations + "):");
        if (edges.isEmpty()) {
            out.nestedLine("pass  # No loop body");
        } else {
            String bodyId = edges.get(0).target();
            out.branch(bodyId, LOOP_VAR, "pass  # Missing loop body target");
            if (context.slotOf(bodyId).isPresent()) {
                out.nestedLine(LOOP_VAR + " = " + NodeEmission.RESULT_VAR);
            }
        }
        out.nestedLine("if " + stop + ":");
        out.nestedLine(CodeDialect.INDENT + "break");
        out.line(NodeEmission.RESULT_VAR + " = " + LOOP_VAR);
    }

    @Override
    public boolean continuesDownstream() {
        return false;
    }
}
