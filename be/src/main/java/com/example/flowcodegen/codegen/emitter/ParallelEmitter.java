package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.model.MergeStrategy;
import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.ParallelData;
import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fans out to the agents on the outgoing edges with {@code asyncio.gather} and merges the
 * results into {@code result}.
 * <p>
 * Only agent targets are invoked. Every other target gets a comment in the gather list and,
 * like the agent targets, is marked visited, so nothing downstream of the fan-out is emitted later.
 * </p>
 */
public class ParallelEmitter implements NodeEmitter {

    @Override
    public NodeType supportedType() {
        return NodeType.PARALLEL;
    }

    @Override
    public void emit(WorkflowNode node, NodeEmission out) {
        TraversalContext context = out.context();
        List<WorkflowEdge> edges = context.outgoing(context.slotOf(node.id()).orElseThrow());
        if (edges.isEmpty()) {
            out.comment("Parallel: No branches defined");
            return;
        }
        ParallelData data = node.dataAs(ParallelData.class, ParallelData::blank);
        MergeStrategy merge = data.merge();
        String policy = data.mergeStrategy() != null && !data.mergeStrategy().isBlank()
                ? data.mergeStrategy()
                : merge.value();

        List<String> entries = new ArrayList<>();
        for (int i = 0; i < edges.size(); i++) {
            Optional<WorkflowNode> target = context.find(edges.get(i).target());
            if (target.isEmpty()) {
                entries.add("None  # Missing target");
            } else if (target.get().kind() == NodeType.AGENT) {
                String variable = context.agentIdentifier(target.get().id());
                entries.add(out.dialect().agentTask(variable, out.inputVar()));
            } else {
                entries.add(out.dialect().comment("Branch " + (i + 1) + ": " + target.get().type()));
            }
        }

        out.comment("Parallel execution (merge: " + policy + ")");
        out.line("results = await asyncio.gather(");
        for (String entry : entries) {
            // a trailing comma after a comment would end up inside it
            out.nestedLine(entry.startsWith("#") ? entry : entry + ",");
        }
        out.line(")");
        out.dialect().unwrapGathered("results").forEach(out::line);
        out.line(mergeLine(merge));

        edges.forEach(edge -> context.markVisited(edge.target()));
    }

    @Override
    public boolean continuesDownstream() {
        return false;
    }

    static String mergeLine(MergeStrategy merge) {
        if (merge == MergeStrategy.CONCAT) {
            return "result = ' '.join(str(r) for r in results)";
        }
        if (merge == MergeStrategy.FIRST) {
            return "result = results[0] if results else \"\"";
        }
        if (merge == MergeStrategy.LAST) {
            return "result = results[-1] if results else \"\"";
        }
        return "result = results  # Custom merge strategy";
    }
}
