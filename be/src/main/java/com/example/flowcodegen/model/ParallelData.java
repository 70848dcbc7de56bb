package com.example.flowcodegen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Fan-out node. {@code mergeStrategy} keeps the raw wire value so it can be echoed in comments.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParallelData(String mergeStrategy) implements NodeData {

    public MergeStrategy merge() {
        return MergeStrategy.fromValue(mergeStrategy);
    }

    public static ParallelData blank() {
        return new ParallelData(null);
    }
}
