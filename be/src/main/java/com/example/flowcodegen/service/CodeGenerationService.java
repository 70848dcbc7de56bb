package com.example.flowcodegen.service;

import com.example.flowcodegen.api.UnknownDialectException;
import com.example.flowcodegen.api.v1.dto.DialectInfoDto;
import com.example.flowcodegen.api.v1.dto.DialectListResponse;
import com.example.flowcodegen.api.v1.dto.GenerateCodeRequest;
import com.example.flowcodegen.api.v1.dto.GeneratedCodeResponse;
import com.example.flowcodegen.codegen.GeneratedCode;
import com.example.flowcodegen.codegen.WorkflowCodeGenerator;
import com.example.flowcodegen.codegen.dialect.DialectRegistry;
import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;
import com.example.flowcodegen.validation.WorkflowGraphValidator;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Application service for compiling editor graphs.
 * <p>
 * Validates the request via {@link WorkflowGraphValidator}, maps it to the graph model and runs the
 * generator of the requested dialect (or the configured default).
 * </p>
 */
@Service
@Slf4j
public class CodeGenerationService {

    static final String DEFAULT_EXPORT_NAME = "workflow";

    private final DialectRegistry dialectRegistry;
    private final WorkflowGraphMapper graphMapper;
    private final String defaultDialect;

    public CodeGenerationService(
            DialectRegistry dialectRegistry,
            WorkflowGraphMapper graphMapper,
            @Value("${flowcodegen.default-dialect:agentchord}") String defaultDialect) {
        this.dialectRegistry = dialectRegistry;
        this.graphMapper = graphMapper;
        if (dialectRegistry.find(defaultDialect).isEmpty()) {
            throw new IllegalStateException("flowcodegen.default-dialect names an unknown dialect: " + defaultDialect);
        }
        this.defaultDialect = defaultDialect.trim();
    }

    public GeneratedCodeResponse generate(GenerateCodeRequest request) {
        WorkflowCodeGenerator generator = resolve(request.dialect());
        WorkflowGraphValidator.validate(request.nodes(), request.edges());
        List<WorkflowNode> nodes = graphMapper.toNodes(request.nodes());
        List<WorkflowEdge> edges = graphMapper.toEdges(request.edges());

        GeneratedCode code = generator.generateParts(nodes, edges);
        log.debug("Generated code dialect={} format={} nodes={} edges={}",
                generator.dialect().id(), code.format().value(), nodes.size(), edges.size());
        return new GeneratedCodeResponse(code.toSource(), code.format().value(), generator.dialect().id());
    }

    /**
     * File name for an exported program: the workflow name with whitespace runs replaced by {@code _}.
     */
    public String exportFileName(String workflowName) {
        String base = workflowName != null && !workflowName.isBlank()
                ? workflowName.trim().replaceAll("\\s+", "_")
                : DEFAULT_EXPORT_NAME;
        return base + ".py";
    }

    public DialectListResponse listDialects() {
        List<DialectInfoDto> dialects = dialectRegistry.getDialects().stream()
                .map(dialect -> new DialectInfoDto(dialect.id(), dialect.description()))
                .collect(Collectors.toList());
        return new DialectListResponse(dialects, defaultDialect);
    }

    private WorkflowCodeGenerator resolve(String dialectId) {
        String id = dialectId != null && !dialectId.isBlank() ? dialectId : defaultDialect;
        return dialectRegistry.find(id)
                .orElseThrow(() -> new UnknownDialectException(id, dialectRegistry.getAvailableDialectIds()));
    }
}
