package org.salesintel.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.salesintel.models.enums.TransformType;

/**
 * Transient copy of an entry under edit. A null {@code confidence} means the committed entry gets
 * the manual default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MappingDraft(
        @JsonProperty("source_field") String sourceField,
        @JsonProperty("target_field") String targetField,
        @JsonProperty("transform") TransformType transform,
        @JsonProperty("confidence") Double confidence
) {
    public MappingDraft {
        sourceField = sourceField == null ? "" : sourceField.trim();
        targetField = targetField == null ? "" : targetField.trim();
        transform = transform == null ? TransformType.NONE : transform;
    }

    public static MappingDraft from(FieldMapping mapping) {
        return new MappingDraft(mapping.sourceField(), mapping.targetField(), mapping.transform(), null);
    }
}
