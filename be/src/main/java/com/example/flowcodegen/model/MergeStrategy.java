package com.example.flowcodegen.model;

/**
 * How a parallel node combines its branch results into one value.
 */
public enum MergeStrategy {
    CONCAT("concat"),
    FIRST("first"),
    LAST("last"),
    CUSTOM("custom");

    private final String value;

    MergeStrategy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Missing values merge by concatenation; unrecognised ones pass the raw results through.
     */
    public static MergeStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CONCAT;
        }
        for (MergeStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value.trim())) {
                return strategy;
            }
        }
        return CUSTOM;
    }
}
