package org.salesintel.models.dto;

public record SchemaResponse(SourceFieldSchema source, CanonicalFieldSchema canonical) {
}
