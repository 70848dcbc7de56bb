package com.example.flowcodegen.codegen.dialect;

import java.util.List;

/**
 * Dialect targeting the {@code agentweave} runtime, whose agents return result objects.
 */
public final class AgentWeaveDialect implements CodeDialect {

    public static final String ID = "agentweave";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Python for the agentweave runtime (Agent.run results, Workflow flow strings)";
    }

    @Override
    public String libraryModule() {
        return "agentweave";
    }

    @Override
    public List<String> headerLines() {
        return List.of("# Generated by the workflow builder (agentweave)");
    }

    @Override
    public String awaitAgentCall(String agentVar, String inputExpr) {
        return "(await " + agentVar + ".run(" + inputExpr + ")).output";
    }

    @Override
    public String agentTask(String agentVar, String inputExpr) {
        return agentVar + ".run(" + inputExpr + ")";
    }

    @Override
    public List<String> unwrapGathered(String resultsVar) {
        // missing targets gather as None and have no output
        return List.of(resultsVar + " = [getattr(r, \"output\", r) for r in " + resultsVar + "]");
    }

    @Override
    public String sectionBanner(String title) {
        return "# ===== " + title + " =====";
    }
}
