package com.example.flowcodegen.codegen;

import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static com.example.flowcodegen.codegen.TestGraphs.agent;
import static com.example.flowcodegen.codegen.TestGraphs.node;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("FormatSelector")
class FormatSelectorTest {

    @Test
    @DisplayName("agents only gives chain")
    void agentsOnly() {
        assertEquals(OutputFormat.CHAIN, FormatSelector.select(List.of(agent("a", "A"), agent("b", "B"))));
    }

    @Test
    @DisplayName("empty graph gives chain")
    void emptyGraph() {
        assertEquals(OutputFormat.CHAIN, FormatSelector.select(List.of()));
    }

    @Test
    @DisplayName("start, end and unknown types do not switch to procedural")
    void passiveTypes() {
        assertEquals(OutputFormat.CHAIN, FormatSelector.select(List.of(
                node("s", NodeType.START),
                agent("a", "A"),
                node("e", NodeType.END),
                new WorkflowNode("x", "sticky_note", null))));
    }

    @ParameterizedTest
    @EnumSource(value = NodeType.class, names = {"CONDITION", "PARALLEL", "BOUNDED_LOOP", "EXTERNAL_TOOL", "TRIGGER", "TEAM"})
    @DisplayName("any control-flow type gives procedural")
    void controlFlowTypes(NodeType type) {
        assertEquals(OutputFormat.PROCEDURAL, FormatSelector.select(List.of(agent("a", "A"), node("x", type))));
    }
}
