package org.salesintel.models.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SaveMappingRequest(@NotNull List<@NotNull FieldMapping> mappings) {
}
