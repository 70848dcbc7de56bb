package com.example.flowcodegen.codegen.dialect;

import com.example.flowcodegen.codegen.WorkflowCodeGenerator;

import java.util.List;
import java.util.Optional;

/**
 * Registry of code generators by dialect id. Used by the code generation service to resolve the
 * dialect requested by the editor.
 */
public interface DialectRegistry {

    /**
     * Returns the generator for the given dialect id (case-insensitive), or empty when unknown.
     */
    Optional<WorkflowCodeGenerator> find(String dialectId);

    /**
     * Returns the registered dialects ordered by id.
     */
    List<CodeDialect> getDialects();

    /**
     * Returns the ids of all registered dialects, sorted.
     */
    List<String> getAvailableDialectIds();
}
