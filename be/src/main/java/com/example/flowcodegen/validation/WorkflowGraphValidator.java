package com.example.flowcodegen.validation;

import com.example.flowcodegen.api.v1.dto.WorkflowEdgeDto;
import com.example.flowcodegen.api.v1.dto.WorkflowNodeDto;
import com.example.flowcodegen.model.BranchTag;
import com.example.flowcodegen.model.NodeType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a submitted graph before compilation: unique node ids, known branch tags, and at most
 * one edge per branch tag leaving a condition.
 * <p>
 * Edges pointing at unknown nodes and unknown node types are accepted; the compiler skips or
 * comments them.
 * </p>
 */
public final class WorkflowGraphValidator {

    private WorkflowGraphValidator() {
    }

    /**
     * Validates the graph. Throws {@link WorkflowGraphValidationException} with all errors if invalid.
     */
    public static void validate(List<WorkflowNodeDto> nodes, List<WorkflowEdgeDto> edges) {
        List<ValidationError> errors = new ArrayList<>();
        if (nodes == null) {
            errors.add(ValidationError.of("nodes", "nodes are required"));
        }
        if (edges == null) {
            errors.add(ValidationError.of("edges", "edges are required"));
        }
        if (!errors.isEmpty()) {
            throw new WorkflowGraphValidationException(errors);
        }

        Map<String, NodeType> types = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            validateNode(i, nodes.get(i), types, errors);
        }

        Set<String> usedBranches = new HashSet<>();
        for (int i = 0; i < edges.size(); i++) {
            validateEdge(i, edges.get(i), types, usedBranches, errors);
        }

        if (!errors.isEmpty()) {
            throw new WorkflowGraphValidationException(errors);
        }
    }

    private static void validateNode(int index, WorkflowNodeDto node, Map<String, NodeType> types, List<ValidationError> errors) {
        if (node == null) {
            errors.add(ValidationError.of("nodes[" + index + "]", "node must not be null"));
            return;
        }
        String prefix = "nodes[" + (node.id() != null ? node.id() : index) + "]";
        if (node.id() == null || node.id().isBlank()) {
            errors.add(ValidationError.of(prefix + ".id", "node id is required"));
            return;
        }
        if (node.type() == null || node.type().isBlank()) {
            errors.add(ValidationError.of(prefix + ".type", "node type is required"));
        }
        if (types.containsKey(node.id())) {
            errors.add(ValidationError.of(prefix + ".id", "duplicate node id: " + node.id()));
            return;
        }
        types.put(node.id(), NodeType.fromValue(node.type()));
    }

    private static void validateEdge(
            int index,
            WorkflowEdgeDto edge,
            Map<String, NodeType> types,
            Set<String> usedBranches,
            List<ValidationError> errors
    ) {
        String prefix = "edges[" + index + "]";
        if (edge == null) {
            errors.add(ValidationError.of(prefix, "edge must not be null"));
            return;
        }
        if (edge.source() == null || edge.source().isBlank()) {
            errors.add(ValidationError.of(prefix + ".source", "edge source is required"));
        }
        if (edge.target() == null || edge.target().isBlank()) {
            errors.add(ValidationError.of(prefix + ".target", "edge target is required"));
        }
        if (edge.branchTag() == null || edge.branchTag().isBlank()) {
            return;
        }
        Optional<BranchTag> tag = BranchTag.fromValue(edge.branchTag());
        if (tag.isEmpty()) {
            errors.add(ValidationError.of(prefix + ".branchTag",
                    "invalid branch tag '" + edge.branchTag() + "'; must be one of: true, false"));
            return;
        }
        if (types.get(edge.source()) == NodeType.CONDITION
                && !usedBranches.add(edge.source() + "\u0000" + tag.get().value())) {
            errors.add(ValidationError.of(prefix + ".branchTag",
                    "condition " + edge.source() + " already has a '" + tag.get().value() + "' branch"));
        }
    }
}
