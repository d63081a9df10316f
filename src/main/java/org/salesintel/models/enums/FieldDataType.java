package org.salesintel.models.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

public enum FieldDataType {
    TEXT("text"),
    INTEGER("integer"),
    FLOAT("float"),
    MONETARY("monetary"),
    DATE("date"),
    DATETIME("datetime"),
    BOOLEAN("boolean"),
    REFERENCE("reference"),
    LIST("list"),
    SELECTION("selection"),
    OBJECT("object");

    // Type names used by provider payloads (Odoo fields_get, Graph, canonical schema service)
    private static final Map<String, FieldDataType> ALIASES = Map.ofEntries(
            Map.entry("char", TEXT),
            Map.entry("string", TEXT),
            Map.entry("html", TEXT),
            Map.entry("int", INTEGER),
            Map.entry("number", FLOAT),
            Map.entry("double", FLOAT),
            Map.entry("decimal", FLOAT),
            Map.entry("currency", MONETARY),
            Map.entry("timestamp", DATETIME),
            Map.entry("bool", BOOLEAN),
            Map.entry("many2one", REFERENCE),
            Map.entry("one2many", LIST),
            Map.entry("many2many", LIST),
            Map.entry("array", LIST),
            Map.entry("picklist", SELECTION),
            Map.entry("dict", OBJECT)
    );

    private final String wireName;

    FieldDataType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isStructured() {
        return this == REFERENCE || this == LIST || this == OBJECT;
    }

    /**
     * Resolves a declared type name, accepting provider aliases. Unrecognized names fall back to
     * {@link #TEXT} so that an unexpected provider type never hides a field from the editor.
     */
    @JsonCreator
    public static FieldDataType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FieldDataType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return ALIASES.getOrDefault(normalized, TEXT);
    }
}
