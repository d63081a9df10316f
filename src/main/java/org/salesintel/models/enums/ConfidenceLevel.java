package org.salesintel.models.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display bucket for a mapping confidence score. Buckets never influence editor behavior.
 */
public enum ConfidenceLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private static final double HIGH_THRESHOLD = 0.90;
    private static final double MEDIUM_THRESHOLD = 0.70;

    private final String wireName;

    ConfidenceLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static ConfidenceLevel of(double confidence) {
        if (confidence >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (confidence >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
