package org.salesintel.service.mapping;

import lombok.extern.slf4j.Slf4j;
import org.salesintel.models.dto.CanonicalFieldDefinition;
import org.salesintel.models.dto.CanonicalFieldSchema;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.MappingCoverage;
import org.salesintel.models.dto.MappingPreview;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.dto.MappingWarning;
import org.salesintel.models.dto.SourceFieldDefinition;
import org.salesintel.models.dto.SourceFieldSchema;
import org.salesintel.models.dto.TransformResult;
import org.salesintel.models.enums.FieldDataType;
import org.salesintel.models.enums.WarningKind;
import org.salesintel.service.transform.TransformCompatibility;
import org.salesintel.service.transform.TransformLibrary;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only analysis of a mapping set: warnings, coverage against the schemas, and a dry run over
 * a sample record.
 */
@Slf4j
@Service
public class MappingSetService {

    public List<MappingWarning> validate(MappingSet set, SourceFieldSchema sourceSchema, CanonicalFieldSchema canonicalSchema) {
        List<MappingWarning> warnings = new ArrayList<>();
        Map<String, Integer> firstByTarget = new HashMap<>();
        List<FieldMapping> entries = set.entries();

        for (int i = 0; i < entries.size(); i++) {
            FieldMapping entry = entries.get(i);
            if (!entry.isComplete()) {
                warnings.add(MappingWarning.forEntry(i, entry, WarningKind.EMPTY_FIELD,
                        "Entry has an empty source or target field"));
            }
            FieldDataType sourceType = null;
            FieldDataType targetType = null;
            if (!entry.sourceField().isEmpty()) {
                sourceType = sourceSchema.find(entry.sourceField()).map(SourceFieldDefinition::type).orElse(null);
                if (sourceType == null) {
                    warnings.add(MappingWarning.forEntry(i, entry, WarningKind.UNKNOWN_SOURCE_FIELD,
                            "Source field '" + entry.sourceField() + "' is not in the source schema"));
                }
            }
            if (!entry.targetField().isEmpty()) {
                targetType = canonicalSchema.find(entry.targetField()).map(CanonicalFieldDefinition::type).orElse(null);
                if (targetType == null) {
                    warnings.add(MappingWarning.forEntry(i, entry, WarningKind.UNKNOWN_TARGET_FIELD,
                            "Target field '" + entry.targetField() + "' is not in the canonical schema"));
                }
                Integer first = firstByTarget.putIfAbsent(entry.targetField(), i);
                if (first != null) {
                    warnings.add(MappingWarning.forEntry(i, entry, WarningKind.DUPLICATE_TARGET,
                            "Target field '" + entry.targetField() + "' is already mapped by entry " + first
                                    + "; the later entry wins"));
                }
            }
            int index = i;
            TransformCompatibility.check(entry.transform(), sourceType, targetType)
                    .ifPresent(message -> warnings.add(
                            MappingWarning.forEntry(index, entry, WarningKind.INCOMPATIBLE_TRANSFORM, message)));
        }
        return warnings;
    }

    public MappingCoverage coverage(MappingSet set, SourceFieldSchema sourceSchema, CanonicalFieldSchema canonicalSchema) {
        Set<String> mappedSources = new HashSet<>();
        Set<String> mappedTargets = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        int mapped = 0;
        for (FieldMapping entry : set.entries()) {
            if (!entry.isComplete()) {
                continue;
            }
            mapped++;
            mappedSources.add(entry.sourceField());
            if (!mappedTargets.add(entry.targetField())) {
                duplicates.add(entry.targetField());
            }
        }
        List<String> unmappedSource = sourceSchema.fieldNames().stream()
                .filter(name -> !mappedSources.contains(name))
                .toList();
        List<String> unmappedTarget = canonicalSchema.fieldNames().stream()
                .filter(name -> !mappedTargets.contains(name))
                .toList();
        List<String> missingRequired = canonicalSchema.requiredFieldNames().stream()
                .filter(name -> !mappedTargets.contains(name))
                .toList();
        return new MappingCoverage(mapped, unmappedSource, unmappedTarget, missingRequired, List.copyOf(duplicates));
    }

    /**
     * Runs every complete entry over {@code record} in order. A later entry writing the same target
     * overwrites the earlier value. Failures are reported per entry and do not stop the run.
     */
    public MappingPreview preview(MappingSet set, Map<String, Object> record) {
        Map<String, Object> sample = record == null ? Map.of() : record;
        Map<String, Object> values = new LinkedHashMap<>();
        List<MappingWarning> warnings = new ArrayList<>();
        List<FieldMapping> entries = set.entries();

        for (int i = 0; i < entries.size(); i++) {
            FieldMapping entry = entries.get(i);
            if (!entry.isComplete()) {
                warnings.add(MappingWarning.forEntry(i, entry, WarningKind.EMPTY_FIELD,
                        "Skipped: entry has an empty source or target field"));
                continue;
            }
            if (!sample.containsKey(entry.sourceField())) {
                warnings.add(MappingWarning.forEntry(i, entry, WarningKind.MISSING_SOURCE_VALUE,
                        "Sample record has no value for '" + entry.sourceField() + "'"));
                continue;
            }
            TransformResult result = TransformLibrary.apply(entry.transform(), sample.get(entry.sourceField()));
            if (!result.successful()) {
                warnings.add(MappingWarning.forEntry(i, entry, WarningKind.TRANSFORM_FAILED, result.error()));
                continue;
            }
            if (values.containsKey(entry.targetField())) {
                warnings.add(MappingWarning.forEntry(i, entry, WarningKind.DUPLICATE_TARGET,
                        "Overwrote the earlier value of '" + entry.targetField() + "'"));
            }
            values.put(entry.targetField(), result.value());
        }
        log.debug("Previewed {} entries for {}: {} values, {} warnings",
                entries.size(), set.key(), values.size(), warnings.size());
        return new MappingPreview(values, warnings);
    }
}
