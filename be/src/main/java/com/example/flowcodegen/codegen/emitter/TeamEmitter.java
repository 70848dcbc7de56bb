package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.codegen.IdentifierResolver;
import com.example.flowcodegen.codegen.dialect.CodeDialect;
import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.TeamData;
import com.example.flowcodegen.model.TeamMember;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares the team's members inline, builds the {@code AgentTeam} and runs it once on the input.
 */
public class TeamEmitter implements NodeEmitter {

    static final String DEFAULT_TEAM_NAME = "team";
    static final String DEFAULT_STRATEGY = "coordinator";
    static final int DEFAULT_MAX_ROUNDS = 10;

    @Override
    public NodeType supportedType() {
        return NodeType.TEAM;
    }

    @Override
    public void emit(WorkflowNode node, NodeEmission out) {
        CodeDialect dialect = out.dialect();
        TeamData data = node.dataAs(TeamData.class, TeamData::blank);
        String teamName = AgentDeclarations.orDefault(data.name(), DEFAULT_TEAM_NAME).trim();
        String teamVar = IdentifierResolver.toSnakeCase(teamName);

        out.comment("Multi-Agent Team: " + teamName);
        List<String> memberVars = new ArrayList<>();
        for (TeamMember member : data.members()) {
            String memberVar = IdentifierResolver.resolve(member.name(), memberVars.size(), "member");
            String displayName = AgentDeclarations.orDefault(member.name(), memberVar);
            memberVars.add(memberVar);
            AgentDeclarations.declare(dialect, "", memberVar, displayName, member.role(), member.model(),
                    member.temperature(), null, member.systemPrompt()).forEach(out::line);
        }

        int maxRounds = data.maxRounds() != null && data.maxRounds() > 0 ? data.maxRounds() : DEFAULT_MAX_ROUNDS;
        out.line(teamVar + " = AgentTeam(");
        out.nestedLine("name=" + dialect.stringLiteral(teamName) + ",");
        out.nestedLine("members=[" + String.join(", ", memberVars) + "],");
        out.nestedLine("strategy=" + dialect.stringLiteral(AgentDeclarations.orDefault(data.strategy(), DEFAULT_STRATEGY)) + ",");
        out.nestedLine("max_rounds=" + maxRounds + ",");
        out.line(")");
        out.line(NodeEmission.RESULT_VAR + " = await " + teamVar + ".run(" + out.inputVar() + ")");
    }
}
