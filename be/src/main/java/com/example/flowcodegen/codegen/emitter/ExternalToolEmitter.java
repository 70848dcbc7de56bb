package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.model.ExternalToolData;
import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Writes a commented-out tool call skeleton. The call itself is left to the user, since the
 * generated program has no connected tool client.
 */
public class ExternalToolEmitter implements NodeEmitter {

    private static final Logger log = LoggerFactory.getLogger(ExternalToolEmitter.class);

    private final JsonMapper jsonMapper;

    public ExternalToolEmitter(JsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    @Override
    public NodeType supportedType() {
        return NodeType.EXTERNAL_TOOL;
    }

    @Override
    public void emit(WorkflowNode node, NodeEmission out) {
        ExternalToolData data = node.dataAs(ExternalToolData.class, ExternalToolData::blank);
        String toolName = AgentDeclarations.orDefault(data.toolName(), "unnamed_tool");
        String serverName = AgentDeclarations.orDefault(data.serverName(), AgentDeclarations.orDefault(data.serverId(), "unknown server"));
        out.comment("MCP Tool: " + toolName + " (" + serverName + ")");
        out.comment("result = await mcp_client.call_tool(");
        out.comment("    server_id=" + out.dialect().stringLiteral(data.serverId()) + ",");
        out.comment("    tool_name=" + out.dialect().stringLiteral(toolName) + ",");
        String[] parameterLines = prettyParameters(data).split("\\R");
        for (int i = 0; i < parameterLines.length; i++) {
            String prefix = i == 0 ? "    parameters=" : "    ";
            String suffix = i == parameterLines.length - 1 ? "," : "";
            out.comment(prefix + parameterLines[i] + suffix);
        }
        out.comment(")");
    }

    private String prettyParameters(ExternalToolData data) {
        try {
            return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data.parameters());
        } catch (JacksonException e) {
            log.debug("Tool parameters not serializable, emitting empty object: {}", e.getOriginalMessage());
            return "{}";
        }
    }
}
