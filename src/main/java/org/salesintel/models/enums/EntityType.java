package org.salesintel.models.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityType {
    ACCOUNT("account"),
    CONTACT("contact"),
    OPPORTUNITY("opportunity"),
    ORDER("order"),
    INVOICE("invoice"),
    LEAD("lead"),
    USER("user"),
    EMAIL("email"),
    CALENDAR("calendar");

    private final String wireName;

    EntityType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EntityType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.wireName.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + value);
    }
}
