package com.example.flowcodegen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Multi-agent team coordinated by {@code strategy} for at most {@code maxRounds} rounds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TeamData(
        String name,
        List<TeamMember> members,
        String strategy,
        Integer maxRounds
) implements NodeData {

    public TeamData {
        members = members != null ? List.copyOf(members) : List.of();
    }

    public static TeamData blank() {
        return new TeamData(null, null, null, null);
    }
}
