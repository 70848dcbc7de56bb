package com.example.flowcodegen.service;

import com.example.flowcodegen.api.v1.dto.WorkflowEdgeDto;
import com.example.flowcodegen.api.v1.dto.WorkflowNodeDto;
import com.example.flowcodegen.model.AgentData;
import com.example.flowcodegen.model.BranchTag;
import com.example.flowcodegen.model.EmptyData;
import com.example.flowcodegen.model.ExternalToolData;
import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.TeamData;
import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;
import com.example.flowcodegen.validation.WorkflowGraphValidationException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("WorkflowGraphMapper")
class WorkflowGraphMapperTest {

    private final WorkflowGraphMapper mapper = new WorkflowGraphMapper(JsonMapper.builder().build());

    @Test
    @DisplayName("maps agent data and ignores unknown fields")
    void agentData() {
        WorkflowNode node = mapper.toNodes(List.of(new WorkflowNodeDto("a1", "agent",
                Map.of("name", "Writer", "temperature", 0.4, "maxTokens", 512, "position", Map.of("x", 1))))).get(0);
        AgentData data = assertInstanceOf(AgentData.class, node.data());
        assertEquals("Writer", data.name());
        assertEquals(Double.valueOf(0.4), data.temperature());
        assertEquals(Integer.valueOf(512), data.maxTokens());
        assertEquals(NodeType.AGENT, node.kind());
    }

    @Test
    @DisplayName("maps nested team members and tool parameters")
    void nestedData() {
        List<WorkflowNode> nodes = mapper.toNodes(List.of(
                new WorkflowNodeDto("t1", "multi_agent", Map.of("name", "Crew",
                        "members", List.of(Map.of("name", "Critic", "role", "Reviews")))),
                new WorkflowNodeDto("m1", "mcp_tool", Map.of("toolName", "search",
                        "parameters", Map.of("limit", 3)))));
        TeamData team = assertInstanceOf(TeamData.class, nodes.get(0).data());
        assertEquals("Critic", team.members().get(0).name());
        ExternalToolData tool = assertInstanceOf(ExternalToolData.class, nodes.get(1).data());
        assertEquals(Map.of("limit", 3), tool.parameters());
    }

    @Test
    @DisplayName("missing data falls back to an empty record of the node type")
    void missingData() {
        WorkflowNode node = mapper.toNodes(List.of(new WorkflowNodeDto("a1", "agent", null))).get(0);
        AgentData data = assertInstanceOf(AgentData.class, node.data());
        assertNull(data.name());
    }

    @Test
    @DisplayName("start, end and unknown types carry no data")
    void dataless() {
        List<WorkflowNode> nodes = mapper.toNodes(List.of(
                new WorkflowNodeDto("s", "start", Map.of("label", "Start")),
                new WorkflowNodeDto("x", "sticky_note", Map.of("text", "hello"))));
        assertEquals(EmptyData.INSTANCE, nodes.get(0).data());
        assertEquals(EmptyData.INSTANCE, nodes.get(1).data());
        assertEquals("sticky_note", nodes.get(1).type());
    }

    @Test
    @DisplayName("rejects data that does not fit the node type")
    void badData() {
        WorkflowGraphValidationException ex = assertThrows(WorkflowGraphValidationException.class,
                () -> mapper.toNodes(List.of(new WorkflowNodeDto("l1", "feedback_loop", Map.of("maxIterations", "many")))));
        assertEquals("nodes[l1].data", ex.getErrors().get(0).field());
    }

    @Test
    @DisplayName("maps branch tags case-insensitively")
    void edges() {
        List<WorkflowEdge> edges = mapper.toEdges(List.of(
                new WorkflowEdgeDto("e1", "c1", "a1", "True"),
                new WorkflowEdgeDto("e2", "a1", "a2", null)));
        assertEquals(BranchTag.TRUE, edges.get(0).branchTag());
        assertNull(edges.get(1).branchTag());
    }
}
