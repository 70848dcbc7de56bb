package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.codegen.dialect.CodeDialect;

import java.util.ArrayList;
import java.util.List;

/**
 * Output buffer of one node emission: literal lines and deferred walks into other nodes,
 * kept in the order they must appear in the generated program.
 */
public final class NodeEmission {

    /** One entry of the walker's worklist. */
    public interface Step {
    }

    public record Line(String text) implements Step {
    }

    /**
     * A deferred visit of the node in {@code slot}. A {@code required} walk that finds the
     * node already emitted writes a {@code pass} placeholder so the enclosing block stays valid.
     */
    public record Walk(int slot, int level, String inputVar, boolean required) implements Step {
    }

    public static final String RESULT_VAR = "result";

    private final TraversalContext context;
    private final int level;
    private final String inputVar;
    private final List<Step> steps = new ArrayList<>();

    public NodeEmission(TraversalContext context, int level, String inputVar) {
        this.context = context;
        this.level = level;
        this.inputVar = inputVar;
    }

    public TraversalContext context() {
        return context;
    }

    public CodeDialect dialect() {
        return context.dialect();
    }

    public int level() {
        return level;
    }

    public String inputVar() {
        return inputVar;
    }

    public static String indent(int level) {
        return CodeDialect.INDENT.repeat(Math.max(0, level));
    }

    /** Adds a line at the node's own indentation. */
    public NodeEmission line(String text) {
        steps.add(new Line(indent(level) + text));
        return this;
    }

    /** Adds a line one level deeper than the node. */
    public NodeEmission nestedLine(String text) {
        steps.add(new Line(indent(level + 1) + text));
        return this;
    }

    public NodeEmission comment(String text) {
        return line(dialect().comment(text));
    }

    /**
     * Walks into {@code targetId} one level deeper, or writes {@code missingPlaceholder} there
     * when the target does not exist.
     */
    public NodeEmission branch(String targetId, String branchInput, String missingPlaceholder) {
        context.slotOf(targetId).ifPresentOrElse(
                slot -> steps.add(new Walk(slot, level + 1, branchInput, true)),
                () -> nestedLine(missingPlaceholder));
        return this;
    }

    /** Continues to a downstream node at the same level, threading {@code result} forward. */
    public NodeEmission follow(int slot) {
        steps.add(new Walk(slot, level, RESULT_VAR, false));
        return this;
    }

    public List<Step> steps() {
        return List.copyOf(steps);
    }
}
