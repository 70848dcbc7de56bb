package com.example.flowcodegen.codegen.dialect;

import java.util.List;

/**
 * Surface syntax of the generated Python program for one agent runtime library.
 * <p>
 * The traversal, ordering and naming are shared; a dialect only decides how imports, agent
 * calls, banners and literals are spelled.
 * </p>
 */
public interface CodeDialect {

    String INDENT = "    ";

    /** Stable id used by the API, e.g. {@code agentchord}. */
    String id();

    String description();

    /** Python module the generated program imports {@code Agent}, {@code Workflow} and {@code AgentTeam} from. */
    String libraryModule();

    /** Lines placed above the imports. */
    default List<String> headerLines() {
        return List.of();
    }

    /** Expression awaiting one agent call and yielding its text output. */
    String awaitAgentCall(String agentVar, String inputExpr);

    /** Un-awaited agent call passed to {@code asyncio.gather}. */
    String agentTask(String agentVar, String inputExpr);

    /**
     * Statements run right after {@code asyncio.gather}, turning the gathered values in
     * {@code resultsVar} into the same text outputs {@link #awaitAgentCall} yields.
     */
    default List<String> unwrapGathered(String resultsVar) {
        return List.of();
    }

    String sectionBanner(String title);

    default String comment(String text) {
        return "# " + (text != null ? text.replace('\r', ' ').replace('\n', ' ') : "");
    }

    default String stringLiteral(String value) {
        String text = value != null ? value : "";
        return "\"" + text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r") + "\"";
    }

    default String tripleQuotedLiteral(String value) {
        String text = value != null ? value : "";
        return "\"\"\"" + text.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"") + "\"\"\"";
    }
}
