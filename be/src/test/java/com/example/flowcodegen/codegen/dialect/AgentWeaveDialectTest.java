package com.example.flowcodegen.codegen.dialect;

import com.example.flowcodegen.codegen.WorkflowCodeGenerator;
import com.example.flowcodegen.model.BranchTag;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.flowcodegen.codegen.TestGraphs.agent;
import static com.example.flowcodegen.codegen.TestGraphs.condition;
import static com.example.flowcodegen.codegen.TestGraphs.edge;
import static com.example.flowcodegen.codegen.TestGraphs.parallel;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AgentWeaveDialect")
class AgentWeaveDialectTest {

    private final WorkflowCodeGenerator generator = new WorkflowCodeGenerator(new AgentWeaveDialect());

    @Test
    @DisplayName("chain imports from agentweave below the header comment")
    void chainImports() {
        String code = generator.generate(List.of(agent("a", "Writer"), agent("b", "Editor")), List.of(edge("a", "b")));
        assertTrue(code.startsWith("# Generated by the workflow builder (agentweave)\nfrom agentweave import Agent, Workflow\n"));
        assertTrue(code.contains("flow=\"writer -> editor\""));
        assertFalse(code.contains("agentchord"));
    }

    @Test
    @DisplayName("procedural code awaits run and reads the output")
    void proceduralCalls() {
        String code = generator.generate(
                List.of(agent("a1", "Validator"), condition("c1", "result.ok"), agent("a2", "Handler")),
                List.of(edge("a1", "c1"), edge("c1", "a2", BranchTag.TRUE)));
        assertTrue(code.contains("# ===== Workflow Logic =====\nasync def workflow_main(input_text: str):"));
        assertTrue(code.contains("    result = (await validator.run(result)).output\n"));
        assertTrue(code.contains("        result = (await handler.run(result)).output\n"));
    }

    @Test
    @DisplayName("gather entries call run without awaiting")
    void gatherEntries() {
        String code = generator.generate(
                List.of(parallel("p1", "last"), agent("a1", "Left"), agent("a2", "Right")),
                List.of(edge("p1", "a1"), edge("p1", "a2")));
        assertTrue(code.contains("        left.run(result),\n        right.run(result),\n    )"));
    }

    @Test
    @DisplayName("gathered results are unwrapped to their output before concat merges them")
    void concatMergesOutputs() {
        String code = generator.generate(
                List.of(parallel("p1", "concat"), agent("a1", "Left"), agent("a2", "Right")),
                List.of(edge("p1", "a1"), edge("p1", "a2")));
        assertTrue(code.contains(String.join("\n",
                "    )",
                "    results = [getattr(r, \"output\", r) for r in results]",
                "    result = ' '.join(str(r) for r in results)")));
    }

    @Test
    @DisplayName("first picks the output of the first branch, matching a direct agent call")
    void firstMergesOutputs() {
        String code = generator.generate(
                List.of(agent("a0", "Next"), parallel("p1", "first"), agent("a1", "Left"), agent("a2", "Right")),
                List.of(edge("a0", "p1"), edge("p1", "a1"), edge("p1", "a2")));
        assertTrue(code.contains("    result = (await next.run(result)).output\n"));
        assertTrue(code.contains(String.join("\n",
                "    results = [getattr(r, \"output\", r) for r in results]",
                "    result = results[0] if results else \"\"")));
    }

    @Test
    @DisplayName("string literals are escaped")
    void escaping() {
        CodeDialect dialect = new AgentWeaveDialect();
        assertEquals("\"say \\\"hi\\\"\\n\"", dialect.stringLiteral("say \"hi\"\n"));
        assertEquals("\"\"", dialect.stringLiteral(null));
        assertEquals("# one two", dialect.comment("one\ntwo"));
    }
}
