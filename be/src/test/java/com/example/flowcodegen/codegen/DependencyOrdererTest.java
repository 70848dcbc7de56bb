package com.example.flowcodegen.codegen;

import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.flowcodegen.codegen.TestGraphs.agent;
import static com.example.flowcodegen.codegen.TestGraphs.edge;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DependencyOrderer")
class DependencyOrdererTest {

    @Nested
    @DisplayName("tie-break")
    class TieBreak {

        @Test
        @DisplayName("zero in-degree nodes keep input-list order")
        void rootsInInputOrder() {
            List<WorkflowNode> nodes = List.of(agent("b", "B"), agent("a", "A"), agent("c", "C"));
            assertEquals(List.of("b", "a", "c"), DependencyOrderer.order(nodes, List.of()));
        }

        @Test
        @DisplayName("nodes released later follow edge-processing order")
        void releasedInEdgeOrder() {
            List<WorkflowNode> nodes = List.of(agent("root", "R"), agent("x", "X"), agent("y", "Y"));
            List<WorkflowEdge> edges = List.of(edge("root", "y"), edge("root", "x"));
            assertEquals(List.of("root", "y", "x"), DependencyOrderer.order(nodes, edges));
        }

        @Test
        @DisplayName("a node waits for all of its predecessors")
        void waitsForAllPredecessors() {
            List<WorkflowNode> nodes = List.of(agent("a", "A"), agent("b", "B"), agent("join", "J"), agent("c", "C"));
            List<WorkflowEdge> edges = List.of(edge("a", "join"), edge("b", "c"), edge("c", "join"));
            assertEquals(List.of("a", "b", "c", "join"), DependencyOrderer.order(nodes, edges));
        }
    }

    @Nested
    @DisplayName("malformed graphs")
    class MalformedGraphs {

        @Test
        @DisplayName("nodes on a cycle and their descendants are left out")
        void cycleExcluded() {
            List<WorkflowNode> nodes = List.of(agent("a", "A"), agent("b", "B"), agent("c", "C"), agent("d", "D"));
            List<WorkflowEdge> edges = List.of(edge("a", "b"), edge("b", "c"), edge("c", "b"), edge("c", "d"));
            assertEquals(List.of("a"), DependencyOrderer.order(nodes, edges));
        }

        @Test
        @DisplayName("edges with unknown endpoints are ignored")
        void danglingEdgesIgnored() {
            List<WorkflowNode> nodes = List.of(agent("a", "A"), agent("b", "B"));
            List<WorkflowEdge> edges = List.of(edge("ghost", "b"), edge("a", "ghost"), edge("a", "b"));
            assertEquals(List.of("a", "b"), DependencyOrderer.order(nodes, edges));
        }

        @Test
        @DisplayName("empty graph gives empty order")
        void emptyGraph() {
            assertTrue(DependencyOrderer.order(List.of(), List.of()).isEmpty());
        }
    }
}
