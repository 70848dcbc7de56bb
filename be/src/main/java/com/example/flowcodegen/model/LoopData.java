package com.example.flowcodegen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Bounded feedback loop: at most {@code maxIterations} passes, stopping early on {@code stopCondition}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoopData(Integer maxIterations, String stopCondition) implements NodeData {

    public static LoopData blank() {
        return new LoopData(null, null);
    }
}
