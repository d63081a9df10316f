package org.salesintel.models.dto;

import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record PreviewRequest(@NotNull Map<String, Object> record) {
}
