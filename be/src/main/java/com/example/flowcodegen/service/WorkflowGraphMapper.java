package com.example.flowcodegen.service;

import com.example.flowcodegen.api.v1.dto.WorkflowEdgeDto;
import com.example.flowcodegen.api.v1.dto.WorkflowNodeDto;
import com.example.flowcodegen.model.AgentData;
import com.example.flowcodegen.model.BranchTag;
import com.example.flowcodegen.model.ConditionData;
import com.example.flowcodegen.model.EmptyData;
import com.example.flowcodegen.model.ExternalToolData;
import com.example.flowcodegen.model.LoopData;
import com.example.flowcodegen.model.NodeData;
import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.ParallelData;
import com.example.flowcodegen.model.TeamData;
import com.example.flowcodegen.model.TriggerData;
import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;
import com.example.flowcodegen.validation.ValidationError;
import com.example.flowcodegen.validation.WorkflowGraphValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps wire DTOs to the compiler's graph model. Each node's free-form {@code data} map is
 * converted to the record of its type; start, end and unknown types carry no data.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowGraphMapper {

    private static final Map<NodeType, Class<? extends NodeData>> DATA_TYPES = new EnumMap<>(NodeType.class);

    static {
        DATA_TYPES.put(NodeType.AGENT, AgentData.class);
        DATA_TYPES.put(NodeType.EXTERNAL_TOOL, ExternalToolData.class);
        DATA_TYPES.put(NodeType.CONDITION, ConditionData.class);
        DATA_TYPES.put(NodeType.PARALLEL, ParallelData.class);
        DATA_TYPES.put(NodeType.BOUNDED_LOOP, LoopData.class);
        DATA_TYPES.put(NodeType.TRIGGER, TriggerData.class);
        DATA_TYPES.put(NodeType.TEAM, TeamData.class);
    }

    private final JsonMapper jsonMapper;

    /**
     * Converts the nodes. Throws {@link WorkflowGraphValidationException} listing every node whose data does not fit its type.
     */
    public List<WorkflowNode> toNodes(List<WorkflowNodeDto> nodes) {
        List<WorkflowNode> result = new ArrayList<>();
        List<ValidationError> errors = new ArrayList<>();
        for (WorkflowNodeDto dto : nodes) {
            try {
                result.add(new WorkflowNode(dto.id(), dto.type(), toData(dto)));
            } catch (JacksonException | IllegalArgumentException e) {
                log.debug("Node data not mappable id={} type={}: {}", dto.id(), dto.type(), e.getMessage());
                errors.add(ValidationError.of("nodes[" + dto.id() + "].data",
                        "data does not match node type '" + dto.type() + "'"));
            }
        }
        if (!errors.isEmpty()) {
            throw new WorkflowGraphValidationException(errors);
        }
        return result;
    }

    public List<WorkflowEdge> toEdges(List<WorkflowEdgeDto> edges) {
        return edges.stream()
                .map(dto -> new WorkflowEdge(dto.id(), dto.source(), dto.target(),
                        BranchTag.fromValue(dto.branchTag()).orElse(null)))
                .toList();
    }

    private NodeData toData(WorkflowNodeDto dto) {
        Class<? extends NodeData> dataType = DATA_TYPES.get(NodeType.fromValue(dto.type()));
        if (dataType == null) {
            return EmptyData.INSTANCE;
        }
        if (dto.data() == null) {
            return jsonMapper.convertValue(Map.of(), dataType);
        }
        return jsonMapper.convertValue(dto.data(), dataType);
    }
}
