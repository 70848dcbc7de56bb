package com.example.flowcodegen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Boolean branch. {@code condition} is copied into the generated code verbatim.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConditionData(String condition, String trueLabel, String falseLabel) implements NodeData {

    public static ConditionData blank() {
        return new ConditionData(null, null, null);
    }
}
