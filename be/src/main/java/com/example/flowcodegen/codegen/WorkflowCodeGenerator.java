package com.example.flowcodegen.codegen;

import com.example.flowcodegen.codegen.dialect.CodeDialect;
import com.example.flowcodegen.codegen.emitter.AgentDeclarations;
import com.example.flowcodegen.codegen.emitter.NodeEmitterRegistry;
import com.example.flowcodegen.codegen.emitter.TraversalContext;
import com.example.flowcodegen.model.AgentData;
import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowEdge;
import com.example.flowcodegen.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiles a workflow graph into a Python program for the runtime described by a {@link CodeDialect}.
 * <p>
 * Graphs made only of agents become a declarative chain ({@code Workflow(agents=..., flow=...)});
 * anything with control flow becomes a {@code workflow_main} function walked from every root.
 * All traversal state lives in a {@link TraversalContext} created per call, so one instance can be
 * shared between threads.
 * </p>
 */
public class WorkflowCodeGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCodeGenerator.class);

    static final String PLACEHOLDER_INPUT = "Your input here";
    private static final String FUNCTION_NAME = "workflow_main";
    private static final String INPUT_PARAM = "input_text";
    private static final String MAIN_GUARD = "if __name__ == \"__main__\":";

    private final CodeDialect dialect;
    private final GraphWalker walker;

    public WorkflowCodeGenerator(CodeDialect dialect) {
        this(dialect, JsonMapper.builder().build());
    }

    public WorkflowCodeGenerator(CodeDialect dialect, JsonMapper jsonMapper) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.walker = new GraphWalker(NodeEmitterRegistry.defaults(jsonMapper));
    }

    public CodeDialect dialect() {
        return dialect;
    }

    @Override
    public String generate(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        return generateParts(nodes, edges).toSource();
    }

    /**
     * Same as {@link #generate} but keeps the program sections apart.
     */
    public GeneratedCode generateParts(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        List<WorkflowNode> nodeList = nodes != null ? nodes : List.of();
        List<WorkflowEdge> edgeList = edges != null ? edges : List.of();
        TraversalContext context = new TraversalContext(nodeList, edgeList, dialect);
        List<WorkflowNode> distinct = context.nodes();

        OutputFormat format = FormatSelector.select(distinct);
        List<String> order = DependencyOrderer.order(distinct, edgeList);
        List<WorkflowNode> agents = agentsInDeclarationOrder(context, order);
        log.debug("Generating code: dialect={}, format={}, nodes={}, edges={}, agents={}",
                dialect.id(), format.value(), distinct.size(), edgeList.size(), agents.size());

        String declarations = declarations(context, agents);
        if (format == OutputFormat.CHAIN) {
            return new GeneratedCode(format, chainImports(agents), declarations,
                    chainBody(context, agents, order), chainEntrypoint(agents));
        }
        boolean async = distinct.stream().map(WorkflowNode::kind).anyMatch(NodeType.SUSPENDING::contains);
        return new GeneratedCode(format, proceduralImports(distinct, async), declarations,
                proceduralBody(context, async), proceduralEntrypoint(async));
    }

    /**
     * Agents in dependency order, then agents the order left out (cycles) in input order.
     */
    private static List<WorkflowNode> agentsInDeclarationOrder(TraversalContext context, List<String> order) {
        Set<WorkflowNode> agents = new LinkedHashSet<>();
        order.forEach(id -> context.find(id)
                .filter(node -> node.kind() == NodeType.AGENT)
                .ifPresent(agents::add));
        context.nodes().stream()
                .filter(node -> node.kind() == NodeType.AGENT)
                .forEach(agents::add);
        return new ArrayList<>(agents);
    }

    private String declarations(TraversalContext context, List<WorkflowNode> agents) {
        Map<String, String> identifiers = context.agentIdentifiers();
        return agents.stream()
                .map(node -> {
                    AgentData data = node.dataAs(AgentData.class, AgentData::blank);
                    String variable = identifiers.get(node.id());
                    String displayName = data.name() != null && !data.name().isBlank() ? data.name() : variable;
                    return String.join("\n", AgentDeclarations.declare(dialect, "", variable, displayName,
                            data.role(), data.model(), data.temperature(), data.maxTokens(), data.systemPrompt()));
                })
                .collect(Collectors.joining("\n\n"));
    }

    private List<String> header() {
        return new ArrayList<>(dialect.headerLines());
    }

    private String chainImports(List<WorkflowNode> agents) {
        List<String> lines = header();
        lines.add("from " + dialect.libraryModule() + " import " + (agents.size() > 1 ? "Agent, Workflow" : "Agent"));
        return String.join("\n", lines);
    }

    private String chainBody(TraversalContext context, List<WorkflowNode> agents, List<String> order) {
        if (agents.size() <= 1) {
            return "";
        }
        String agentList = agents.stream()
                .map(node -> context.agentIdentifier(node.id()))
                .collect(Collectors.joining(", "));
        String flow = order.stream()
                .filter(id -> context.find(id).map(node -> node.kind() == NodeType.AGENT).orElse(false))
                .map(context::agentIdentifier)
                .collect(Collectors.joining(" -> "));
        return String.join("\n",
                "workflow = Workflow(",
                CodeDialect.INDENT + "agents=[" + agentList + "],",
                CodeDialect.INDENT + "flow=" + dialect.stringLiteral(flow) + ",",
                ")");
    }

    private String chainEntrypoint(List<WorkflowNode> agents) {
        // only a Workflow aggregate has something to run; a lone agent gets a placeholder
        if (agents.size() <= 1) {
            return String.join("\n",
                    MAIN_GUARD,
                    CodeDialect.INDENT + dialect.comment("Add your workflow execution here"),
                    CodeDialect.INDENT + "pass");
        }
        return String.join("\n",
                MAIN_GUARD,
                CodeDialect.INDENT + "result = workflow.run_sync(" + dialect.stringLiteral(PLACEHOLDER_INPUT) + ")",
                CodeDialect.INDENT + "print(result.output)");
    }

    private String proceduralImports(List<WorkflowNode> nodes, boolean async) {
        Set<NodeType> kinds = nodes.stream().map(WorkflowNode::kind).collect(Collectors.toSet());
        List<String> lines = header();
        if (async) {
            lines.add("import asyncio");
        }
        lines.add("from " + dialect.libraryModule() + " import "
                + (kinds.contains(NodeType.TEAM) ? "Agent, AgentTeam" : "Agent"));
        if (kinds.contains(NodeType.EXTERNAL_TOOL)) {
            lines.add("# from " + dialect.libraryModule() + ".protocols.mcp import MCPClient");
        }
        return String.join("\n", lines);
    }

    private String proceduralBody(TraversalContext context, boolean async) {
        String indent = CodeDialect.INDENT;
        List<String> lines = new ArrayList<>();
        lines.add(dialect.sectionBanner("Workflow Logic"));
        lines.add((async ? "async def " : "def ") + FUNCTION_NAME + "(" + INPUT_PARAM + ": str):");

        List<Integer> roots = new ArrayList<>();
        for (int slot = 0; slot < context.size(); slot++) {
            if (!context.hasIncomingEdge(slot) && context.node(slot).kind() != NodeType.END) {
                roots.add(slot);
            }
        }
        if (roots.isEmpty()) {
            lines.add(indent + dialect.comment("No start node found. Define entry point."));
            lines.add(indent + "result = " + INPUT_PARAM);
        }
        for (int root : roots) {
            if (context.isVisited(root)) {
                continue;
            }
            lines.add(indent + "result = " + INPUT_PARAM);
            lines.addAll(walker.walk(context, root, 1, "result"));
        }
        lines.add(indent + "return result");
        return String.join("\n", lines);
    }

    private String proceduralEntrypoint(boolean async) {
        String call = FUNCTION_NAME + "(" + INPUT_PARAM + ")";
        return String.join("\n",
                MAIN_GUARD,
                CodeDialect.INDENT + INPUT_PARAM + " = " + dialect.stringLiteral(PLACEHOLDER_INPUT),
                CodeDialect.INDENT + "result = " + (async ? "asyncio.run(" + call + ")" : call),
                CodeDialect.INDENT + "print(result)");
    }
}
