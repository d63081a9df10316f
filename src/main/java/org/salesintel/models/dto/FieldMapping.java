package org.salesintel.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.salesintel.models.enums.Provenance;
import org.salesintel.models.enums.TransformType;

/**
 * One source-to-canonical field correspondence. Source and target may be empty while the entry is
 * a draft; a missing transform reads as {@link TransformType#NONE}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldMapping(
        @JsonProperty("source_field") String sourceField,
        @JsonProperty("target_field") String targetField,
        @JsonProperty("transform") TransformType transform,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("provenance") Provenance provenance
) {
    public static final double DRAFT_CONFIDENCE = 0.5;
    public static final double MANUAL_CONFIDENCE = 1.0;

    public FieldMapping {
        sourceField = sourceField == null ? "" : sourceField.trim();
        targetField = targetField == null ? "" : targetField.trim();
        transform = transform == null ? TransformType.NONE : transform;
        confidence = confidence == null ? MANUAL_CONFIDENCE : confidence;
        provenance = provenance == null ? Provenance.MANUAL : provenance;
        if (confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0.0, 1.0] but was " + confidence);
        }
    }

    public static FieldMapping blankDraft() {
        return new FieldMapping("", "", TransformType.NONE, DRAFT_CONFIDENCE, Provenance.MANUAL);
    }

    public static FieldMapping of(String sourceField, String targetField, TransformType transform,
                                  double confidence, Provenance provenance) {
        return new FieldMapping(sourceField, targetField, transform, confidence, provenance);
    }

    public FieldMapping withProvenance(Provenance newProvenance) {
        return new FieldMapping(sourceField, targetField, transform, confidence, newProvenance);
    }

    @JsonIgnore
    public boolean isComplete() {
        return !sourceField.isEmpty() && !targetField.isEmpty();
    }
}
