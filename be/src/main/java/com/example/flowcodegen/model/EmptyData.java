package com.example.flowcodegen.model;

/**
 * Data for start, end and unrecognised nodes; nothing in it is read by the generator.
 */
public record EmptyData() implements NodeData {

    public static final EmptyData INSTANCE = new EmptyData();
}
