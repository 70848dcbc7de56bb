package com.example.flowcodegen.codegen;

import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Deterministic topological order over a workflow graph (Kahn's algorithm).
 * <p>
 * Ties are broken by insertion order: zero in-degree nodes are seeded in input-list order, and
 * nodes that become ready later are queued in edge-processing order. Nodes on a cycle, and
 * anything reachable only through one, never reach in-degree zero and are left out.
 * Edges with an unknown source or target are ignored.
 * </p>
 */
public final class DependencyOrderer {

    private DependencyOrderer() {
    }

    public static List<String> order(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> adjacency = new HashMap<>();
        for (WorkflowNode node : nodes) {
            inDegree.put(node.id(), 0);
            adjacency.put(node.id(), new ArrayList<>());
        }
        for (WorkflowEdge edge : edges) {
            if (!inDegree.containsKey(edge.source()) || !inDegree.containsKey(edge.target())) {
                continue;
            }
            inDegree.merge(edge.target(), 1, Integer::sum);
            adjacency.get(edge.source()).add(edge.target());
        }

        Queue<String> queue = new ArrayDeque<>();
        Set<String> seeded = new HashSet<>();
        for (WorkflowNode node : nodes) {
            if (inDegree.get(node.id()) == 0 && seeded.add(node.id())) {
                queue.add(node.id());
            }
        }

        List<String> result = new ArrayList<>();
        while (!queue.isEmpty()) {
            String nodeId = queue.poll();
            result.add(nodeId);
            for (String neighbor : adjacency.get(nodeId)) {
                int degree = inDegree.merge(neighbor, -1, Integer::sum);
                if (degree == 0) {
                    queue.add(neighbor);
                }
            }
        }
        return result;
    }
}
