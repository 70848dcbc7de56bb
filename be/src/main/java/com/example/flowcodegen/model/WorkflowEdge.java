package com.example.flowcodegen.model;

import java.util.Objects;

/**
 * Directed control/data flow between two nodes. {@code branchTag} is only set on edges
 * leaving a condition node.
 */
public record WorkflowEdge(String id, String source, String target, BranchTag branchTag) {

    public WorkflowEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public boolean isTagged(BranchTag tag) {
        return branchTag == tag;
    }
}
