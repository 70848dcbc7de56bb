package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.model.BranchTag;
import com.example.flowcodegen.model.ConditionData;
import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.List;
import java.util.Optional;

/**
 * Lowers a condition node to {@code if/else}. The expression is copied verbatim; only the first
 * edge carrying each branch tag is used.
 */
public class ConditionEmitter implements NodeEmitter {

    static final String FALLBACK_EXPRESSION = "False";

    @Override
    public NodeType supportedType() {
        return NodeType.CONDITION;
    }

    @Override
    public void emit(WorkflowNode node, NodeEmission out) {
        ConditionData data = node.dataAs(ConditionData.class, ConditionData::blank);
        String expression = data.condition() != null && !data.condition().isBlank()
                ? data.condition().trim()
                : FALLBACK_EXPRESSION;
        List<WorkflowEdge> edges = out.context().outgoing(out.context().slotOf(node.id()).orElseThrow());
        Optional<WorkflowEdge> trueEdge = firstTagged(edges, BranchTag.TRUE);
        Optional<WorkflowEdge> falseEdge = firstTagged(edges, BranchTag.FALSE);

        out.comment("Condition: " + expression);
        out.line("if " + expression + ":" + label(out, data.trueLabel()));
        if (trueEdge.isPresent()) {
            out.branch(trueEdge.get().target(), out.inputVar(), "pass  # Missing true branch target");
        } else {
            out.nestedLine("pass  # No true branch");
        }
        if (falseEdge.isPresent()) {
            out.line("else:" + label(out, data.falseLabel()));
            out.branch(falseEdge.get().target(), out.inputVar(), "pass  # Missing false branch target");
        }
    }

    @Override
    public boolean continuesDownstream() {
        return false;
    }

    private static Optional<WorkflowEdge> firstTagged(List<WorkflowEdge> edges, BranchTag tag) {
        return edges.stream().filter(edge -> edge.isTagged(tag)).findFirst();
    }

    private static String label(NodeEmission out, String label) {
        if (label == null || label.isBlank()) {
            return "";
        }
        return "  " + out.dialect().comment(label.trim());
    }
}
