package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.codegen.IdentifierResolver;
import com.example.flowcodegen.codegen.dialect.CodeDialect;
import com.example.flowcodegen.model.AgentData;
import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one code generation run: the node arena, outgoing edges per node, the visited set
 * and the resolved agent identifiers.
 * <p>
 * Built fresh for every {@code generate} call and never shared, so generators themselves hold
 * no mutable state. When an id occurs twice the later definition wins and keeps the earlier slot.
 * </p>
 */
public final class TraversalContext {

    private final CodeDialect dialect;
    private final List<WorkflowNode> arena = new ArrayList<>();
    private final Map<String, Integer> slots = new HashMap<>();
    private final List<List<WorkflowEdge>> outgoing = new ArrayList<>();
    private final BitSet visited = new BitSet();
    private final BitSet hasIncoming = new BitSet();
    private final Map<String, String> agentIdentifiers = new LinkedHashMap<>();

    public TraversalContext(List<WorkflowNode> nodes, List<WorkflowEdge> edges, CodeDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        for (WorkflowNode node : nodes) {
            Integer existing = slots.get(node.id());
            if (existing != null) {
                arena.set(existing, node);
                continue;
            }
            slots.put(node.id(), arena.size());
            arena.add(node);
            outgoing.add(new ArrayList<>());
        }
        for (WorkflowEdge edge : edges) {
            Integer source = slots.get(edge.source());
            if (source == null) {
                continue;
            }
            outgoing.get(source).add(edge);
            Integer target = slots.get(edge.target());
            if (target != null) {
                hasIncoming.set(target);
            }
        }
        int agentIndex = 0;
        for (WorkflowNode node : arena) {
            if (node.kind() == NodeType.AGENT) {
                AgentData data = node.dataAs(AgentData.class, AgentData::blank);
                agentIdentifiers.put(node.id(), IdentifierResolver.resolve(data.name(), agentIndex));
                agentIndex++;
            }
        }
    }

    public CodeDialect dialect() {
        return dialect;
    }

    /** Nodes in input order, one per distinct id. */
    public List<WorkflowNode> nodes() {
        return List.copyOf(arena);
    }

    public int size() {
        return arena.size();
    }

    public WorkflowNode node(int slot) {
        return arena.get(slot);
    }

    public Optional<Integer> slotOf(String nodeId) {
        return Optional.ofNullable(slots.get(nodeId));
    }

    public Optional<WorkflowNode> find(String nodeId) {
        return slotOf(nodeId).map(arena::get);
    }

    /** Outgoing edges of the node in declaration order; edges with an unknown source are not listed anywhere. */
    public List<WorkflowEdge> outgoing(int slot) {
        return outgoing.get(slot);
    }

    public boolean hasIncomingEdge(int slot) {
        return hasIncoming.get(slot);
    }

    /**
     * Marks the node visited.
     *
     * @return {@code true} if it was not visited before
     */
    public boolean markVisited(int slot) {
        if (visited.get(slot)) {
            return false;
        }
        visited.set(slot);
        return true;
    }

    public void markVisited(String nodeId) {
        slotOf(nodeId).ifPresent(visited::set);
    }

    public boolean isVisited(int slot) {
        return visited.get(slot);
    }

    /**
     * Identifier of an agent node; falls back to a name derived from the id for anything
     * that is not an agent.
     */
    public String agentIdentifier(String nodeId) {
        String identifier = agentIdentifiers.get(nodeId);
        if (identifier != null) {
            return identifier;
        }
        return "agent_" + IdentifierResolver.toSnakeCase(nodeId.length() > 8 ? nodeId.substring(0, 8) : nodeId);
    }

    /** Agent node id to identifier, in input order. */
    public Map<String, String> agentIdentifiers() {
        return Map.copyOf(agentIdentifiers);
    }
}
