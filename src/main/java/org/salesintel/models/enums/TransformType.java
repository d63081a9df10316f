package org.salesintel.models.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TransformType {
    NONE("none", "None (Direct)"),
    EXTRACT_ID("extract_id", "Extract ID (Reference)"),
    EXTRACT_NAME("extract_name", "Extract Name (Reference)"),
    TO_STRING("to_string", "Convert to String"),
    TO_FLOAT("to_float", "Convert to Number"),
    TO_INT("to_int", "Convert to Integer"),
    BOOLEAN("boolean", "Convert to Boolean"),
    DATE_PARSE("date_parse", "Parse Date");

    private final String wireName;
    private final String label;

    TransformType(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    /**
     * Blank names read as {@link #NONE}: stored mappings carry either {@code null}, an empty string
     * or {@code "none"} for a direct copy.
     */
    @JsonCreator
    public static TransformType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TransformType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transform: " + value);
    }
}
