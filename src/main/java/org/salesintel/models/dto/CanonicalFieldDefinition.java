package org.salesintel.models.dto;

import org.salesintel.models.enums.FieldDataType;

/**
 * Canonical field. {@code required} marks the minimum a synced record needs to be usable; it is
 * advisory and never enforced while configuring mappings.
 */
public record CanonicalFieldDefinition(String name, FieldDataType type, boolean required, String description) {

    public CanonicalFieldDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Canonical field name is required");
        }
        type = type == null ? FieldDataType.TEXT : type;
        description = description == null ? "" : description;
    }
}
