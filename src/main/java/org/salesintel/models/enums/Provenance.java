package org.salesintel.models.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Provenance {
    MANUAL("manual"),
    AI_SUGGESTED("ai_suggested"),
    DEFAULT("default");

    private final String wireName;

    Provenance(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Provenance fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return MANUAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Provenance provenance : values()) {
            if (provenance.wireName.equals(normalized)) {
                return provenance;
            }
        }
        throw new IllegalArgumentException("Unknown provenance: " + value);
    }
}
