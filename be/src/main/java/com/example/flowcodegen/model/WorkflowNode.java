package com.example.flowcodegen.model;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * One step of a workflow graph.
 * <p>
 * {@code type} is kept as sent by the editor so unrecognised types can still be reported
 * in generated comments; {@link #kind()} gives the typed view.
 * </p>
 */
public record WorkflowNode(String id, String type, NodeData data) {

    public WorkflowNode {
        Objects.requireNonNull(id, "id");
        data = data != null ? data : EmptyData.INSTANCE;
    }

    public WorkflowNode(String id, NodeType type, NodeData data) {
        this(id, type.value(), data);
    }

    public NodeType kind() {
        return NodeType.fromValue(type);
    }

    /**
     * Returns the data as {@code dataType}, or the fallback when the node carries something else.
     */
    public <T extends NodeData> T dataAs(Class<T> dataType, Supplier<T> fallback) {
        if (dataType.isInstance(data)) {
            return dataType.cast(data);
        }
        return fallback.get();
    }
}
