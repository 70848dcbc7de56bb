package com.example.flowcodegen.api.v1.dto;

/**
 * Summary of a bundled sample graph.
 */
public record SampleListItem(String id, String name, int nodeCount, int edgeCount) {
}
