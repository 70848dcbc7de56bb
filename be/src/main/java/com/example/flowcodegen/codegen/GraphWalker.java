package com.example.flowcodegen.codegen;

import com.example.flowcodegen.codegen.emitter.NodeEmission;
import com.example.flowcodegen.codegen.emitter.NodeEmitter;
import com.example.flowcodegen.codegen.emitter.NodeEmitterRegistry;
import com.example.flowcodegen.codegen.emitter.TraversalContext;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Depth-first emission of the graph below a root, driven by an explicit stack instead of recursion.
 * <p>
 * Each node is emitted at most once per {@link TraversalContext}: the first path to reach a shared
 * node emits it, later paths skip it. A branch body that turns out to be already emitted, or that
 * contains only comments, gets a {@code pass} statement so the enclosing block stays valid.
 * </p>
 */
public class GraphWalker {

    private final NodeEmitterRegistry emitters;

    public GraphWalker(NodeEmitterRegistry emitters) {
        this.emitters = emitters;
    }

    public List<String> walk(TraversalContext context, int rootSlot, int level, String inputVar) {
        List<String> lines = new ArrayList<>();
        Deque<NodeEmission.Step> stack = new ArrayDeque<>();
        stack.push(new NodeEmission.Walk(rootSlot, level, inputVar, false));

        while (!stack.isEmpty()) {
            NodeEmission.Step step = stack.pop();
            if (step instanceof NodeEmission.Line line) {
                lines.add(line.text());
                continue;
            }
            NodeEmission.Walk walk = (NodeEmission.Walk) step;
            WorkflowNode node = context.node(walk.slot());
            if (!context.markVisited(walk.slot())) {
                if (walk.required()) {
                    lines.add(NodeEmission.indent(walk.level()) + "pass  # Already emitted: " + node.id());
                }
                continue;
            }

            NodeEmitter emitter = emitters.get(node.kind());
            NodeEmission emission = new NodeEmission(context, walk.level(), walk.inputVar());
            emitter.emit(node, emission);
            if (walk.required() && !hasStatement(emission)) {
                emission.line("pass");
            }
            if (emitter.continuesDownstream()) {
                context.outgoing(walk.slot()).forEach(edge ->
                        context.slotOf(edge.target()).ifPresent(emission::follow));
            }

            List<NodeEmission.Step> steps = emission.steps();
            for (int i = steps.size() - 1; i >= 0; i--) {
                stack.push(steps.get(i));
            }
        }
        return lines;
    }

    private static boolean hasStatement(NodeEmission emission) {
        return emission.steps().stream()
                .filter(NodeEmission.Line.class::isInstance)
                .map(step -> ((NodeEmission.Line) step).text().strip())
                .anyMatch(text -> !text.isEmpty() && !text.startsWith("#"));
    }
}
