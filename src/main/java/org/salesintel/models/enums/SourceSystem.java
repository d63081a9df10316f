package org.salesintel.models.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * External systems whose records can be mapped onto the canonical schema, together with the
 * entity types each one advertises to operators.
 */
public enum SourceSystem {
    ODOO("odoo", "Odoo ERP",
            List.of(EntityType.ACCOUNT, EntityType.CONTACT, EntityType.OPPORTUNITY, EntityType.ORDER, EntityType.INVOICE)),
    MS365("ms365", "Microsoft 365",
            List.of(EntityType.USER, EntityType.EMAIL, EntityType.CALENDAR)),
    SALESFORCE("salesforce", "Salesforce",
            List.of(EntityType.LEAD, EntityType.ACCOUNT, EntityType.OPPORTUNITY));

    private final String wireName;
    private final String displayName;
    private final List<EntityType> entityTypes;

    SourceSystem(String wireName, String displayName, List<EntityType> entityTypes) {
        this.wireName = wireName;
        this.displayName = displayName;
        this.entityTypes = entityTypes;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    public List<EntityType> entityTypes() {
        return entityTypes;
    }

    public boolean supports(EntityType entityType) {
        return entityTypes.contains(entityType);
    }

    @JsonCreator
    public static SourceSystem fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Source system is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceSystem system : values()) {
            if (system.wireName.equals(normalized) || system.name().equalsIgnoreCase(normalized)) {
                return system;
            }
        }
        throw new IllegalArgumentException("Unknown source system: " + value);
    }
}
