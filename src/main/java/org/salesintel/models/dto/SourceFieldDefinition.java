package org.salesintel.models.dto;

import org.salesintel.models.enums.FieldDataType;

public record SourceFieldDefinition(String name, String label, FieldDataType type) {

    public SourceFieldDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Source field name is required");
        }
        label = label == null || label.isBlank() ? name : label;
        type = type == null ? FieldDataType.TEXT : type;
    }
}
