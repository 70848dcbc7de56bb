package com.example.flowcodegen.codegen.dialect;

/**
 * Default dialect targeting the {@code agentchord} runtime.
 */
public final class AgentChordDialect implements CodeDialect {

    public static final String ID = "agentchord";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Python for the agentchord runtime (Agent.complete, Workflow flow strings)";
    }

    @Override
    public String libraryModule() {
        return "agentchord";
    }

    @Override
    public String awaitAgentCall(String agentVar, String inputExpr) {
        return "await " + agentVar + ".complete(" + inputExpr + ")";
    }

    @Override
    public String agentTask(String agentVar, String inputExpr) {
        return agentVar + ".complete(" + inputExpr + ")";
    }

    @Override
    public String sectionBanner(String title) {
        return "# --- " + title + " ---";
    }
}
