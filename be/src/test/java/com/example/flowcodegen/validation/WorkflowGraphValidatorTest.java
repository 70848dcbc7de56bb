package com.example.flowcodegen.validation;

import com.example.flowcodegen.api.v1.dto.WorkflowEdgeDto;
import com.example.flowcodegen.api.v1.dto.WorkflowNodeDto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowGraphValidator")
class WorkflowGraphValidatorTest {

    private static WorkflowNodeDto node(String id, String type) {
        return new WorkflowNodeDto(id, type, Map.of());
    }

    private static WorkflowEdgeDto edge(String source, String target, String tag) {
        return new WorkflowEdgeDto(source + "-" + target, source, target, tag);
    }

    @Nested
    @DisplayName("valid graph")
    class ValidGraph {

        @Test
        @DisplayName("passes for a condition with one true and one false edge")
        void conditionWithBothBranches() {
            List<WorkflowNodeDto> nodes = List.of(node("c1", "condition"), node("a1", "agent"), node("a2", "agent"));
            List<WorkflowEdgeDto> edges = List.of(edge("c1", "a1", "true"), edge("c1", "a2", "FALSE"));
            assertDoesNotThrow(() -> WorkflowGraphValidator.validate(nodes, edges));
        }

        @Test
        @DisplayName("passes for dangling edges and unknown node types")
        void tolerated() {
            List<WorkflowNodeDto> nodes = List.of(node("a1", "agent"), node("n1", "sticky_note"));
            List<WorkflowEdgeDto> edges = List.of(edge("a1", "ghost", null), edge("phantom", "a1", ""));
            assertDoesNotThrow(() -> WorkflowGraphValidator.validate(nodes, edges));
        }

        @Test
        @DisplayName("passes for an empty graph")
        void emptyGraph() {
            assertDoesNotThrow(() -> WorkflowGraphValidator.validate(List.of(), List.of()));
        }
    }

    @Nested
    @DisplayName("invalid graph")
    class InvalidGraph {

        @Test
        @DisplayName("fails when nodes or edges are missing")
        void missingLists() {
            WorkflowGraphValidationException ex = assertThrows(WorkflowGraphValidationException.class,
                    () -> WorkflowGraphValidator.validate(null, null));
            assertEquals(2, ex.getErrors().size());
            assertEquals("nodes", ex.getErrors().get(0).field());
            assertEquals("edges", ex.getErrors().get(1).field());
        }

        @Test
        @DisplayName("fails on duplicate node ids")
        void duplicateIds() {
            List<WorkflowNodeDto> nodes = List.of(node("a1", "agent"), node("a1", "condition"));
            WorkflowGraphValidationException ex = assertThrows(WorkflowGraphValidationException.class,
                    () -> WorkflowGraphValidator.validate(nodes, List.of()));
            assertEquals(1, ex.getErrors().size());
            assertEquals("nodes[a1].id", ex.getErrors().get(0).field());
            assertTrue(ex.getErrors().get(0).message().contains("duplicate"));
        }

        @Test
        @DisplayName("fails on an unknown branch tag")
        void unknownTag() {
            List<WorkflowNodeDto> nodes = List.of(node("c1", "condition"), node("a1", "agent"));
            WorkflowGraphValidationException ex = assertThrows(WorkflowGraphValidationException.class,
                    () -> WorkflowGraphValidator.validate(nodes, List.of(edge("c1", "a1", "maybe"))));
            assertEquals("edges[0].branchTag", ex.getErrors().get(0).field());
        }

        @Test
        @DisplayName("fails when a condition has two edges with the same tag")
        void doubledTag() {
            List<WorkflowNodeDto> nodes = List.of(node("c1", "condition"), node("a1", "agent"), node("a2", "agent"));
            List<WorkflowEdgeDto> edges = List.of(edge("c1", "a1", "true"), edge("c1", "a2", "true"));
            WorkflowGraphValidationException ex = assertThrows(WorkflowGraphValidationException.class,
                    () -> WorkflowGraphValidator.validate(nodes, edges));
            assertEquals(1, ex.getErrors().size());
            assertEquals("edges[1].branchTag", ex.getErrors().get(0).field());
        }

        @Test
        @DisplayName("collects every error before failing")
        void collectsAll() {
            List<WorkflowNodeDto> nodes = List.of(node("a1", "agent"), node("a1", "agent"), node(" ", "agent"));
            List<WorkflowEdgeDto> edges = List.of(new WorkflowEdgeDto("e1", "", "a1", "yes"));
            WorkflowGraphValidationException ex = assertThrows(WorkflowGraphValidationException.class,
                    () -> WorkflowGraphValidator.validate(nodes, edges));
            assertEquals(4, ex.getErrors().size());
        }
    }
}
