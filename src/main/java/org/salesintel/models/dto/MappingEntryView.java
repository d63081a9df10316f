package org.salesintel.models.dto;

import org.salesintel.models.enums.ConfidenceLevel;
import org.salesintel.models.enums.Provenance;
import org.salesintel.models.enums.TransformType;

public record MappingEntryView(
        int index,
        String sourceField,
        String targetField,
        TransformType transform,
        String transformLabel,
        double confidence,
        ConfidenceLevel confidenceLevel,
        Provenance provenance,
        boolean editing
) {
    public static MappingEntryView of(int index, FieldMapping mapping, boolean editing) {
        return new MappingEntryView(
                index,
                mapping.sourceField(),
                mapping.targetField(),
                mapping.transform(),
                mapping.transform().label(),
                mapping.confidence(),
                ConfidenceLevel.of(mapping.confidence()),
                mapping.provenance(),
                editing
        );
    }
}
