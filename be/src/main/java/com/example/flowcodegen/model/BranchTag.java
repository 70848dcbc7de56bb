package com.example.flowcodegen.model;

import java.util.Optional;

/**
 * Outcome marker on an edge leaving a condition node.
 */
public enum BranchTag {
    TRUE("true"),
    FALSE("false");

    private final String value;

    BranchTag(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<BranchTag> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (BranchTag tag : values()) {
            if (tag.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
