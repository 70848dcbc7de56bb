package com.example.flowcodegen.api.v1.dto;

public record DialectInfoDto(String id, String description) {
}
