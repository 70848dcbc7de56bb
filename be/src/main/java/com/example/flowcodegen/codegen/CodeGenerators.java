package com.example.flowcodegen.codegen;

import com.example.flowcodegen.codegen.dialect.AgentChordDialect;
import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.List;

/**
 * Entry point for callers that just want the default output.
 */
public final class CodeGenerators {

    private static final CodeGenerator DEFAULT = new WorkflowCodeGenerator(new AgentChordDialect());

    private CodeGenerators() {
    }

    public static String generateCode(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        return DEFAULT.generate(nodes, edges);
    }
}
