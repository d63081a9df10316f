package org.salesintel.models.dto;

import org.salesintel.models.enums.WarningKind;

/**
 * Non-blocking problem attached to one entry of a mapping set. {@code index} is null for warnings
 * that concern the draft rather than a stored entry.
 */
public record MappingWarning(Integer index, String sourceField, String targetField, WarningKind kind, String message) {

    public static MappingWarning forEntry(int index, FieldMapping mapping, WarningKind kind, String message) {
        return new MappingWarning(index, mapping.sourceField(), mapping.targetField(), kind, message);
    }
}
