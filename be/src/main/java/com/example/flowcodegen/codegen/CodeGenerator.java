package com.example.flowcodegen.codegen;

import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.List;

/**
 * Compiles a workflow graph snapshot into program text.
 * Implementations never mutate their inputs and never throw for graph content.
 */
@FunctionalInterface
public interface CodeGenerator {

    String generate(List<WorkflowNode> nodes, List<WorkflowEdge> edges);
}
