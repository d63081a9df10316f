package org.salesintel.models.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WarningKind {
    EMPTY_FIELD("empty_field"),
    UNKNOWN_SOURCE_FIELD("unknown_source_field"),
    UNKNOWN_TARGET_FIELD("unknown_target_field"),
    INCOMPATIBLE_TRANSFORM("incompatible_transform"),
    DUPLICATE_TARGET("duplicate_target"),
    MISSING_SOURCE_VALUE("missing_source_value"),
    TRANSFORM_FAILED("transform_failed");

    private final String wireName;

    WarningKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
