package com.example.flowcodegen.api.v1.dto;

import java.util.List;

public record DialectListResponse(List<DialectInfoDto> dialects, String defaultDialect) {
}
