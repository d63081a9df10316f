package org.salesintel.models.dto;

import java.util.List;

public record MappingCoverage(
        int mappedCount,
        List<String> unmappedSourceFields,
        List<String> unmappedTargetFields,
        List<String> missingRequiredTargets,
        List<String> duplicateTargets
) {
}
