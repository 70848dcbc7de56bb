package com.example.flowcodegen.api.v1.dto;

import java.util.List;

public record SampleListResponse(List<SampleListItem> samples) {
}
