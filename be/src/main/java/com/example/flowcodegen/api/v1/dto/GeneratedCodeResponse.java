package com.example.flowcodegen.api.v1.dto;

/**
 * Generated program text with the output format ("chain" or "procedural") and dialect used.
 */
public record GeneratedCodeResponse(String code, String format, String dialect) {
}
