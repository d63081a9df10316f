package org.salesintel.models.dto;

import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

import java.util.List;

public record SupportedSystemView(SourceSystem system, String displayName, List<EntityType> entityTypes) {

    public static SupportedSystemView of(SourceSystem system) {
        return new SupportedSystemView(system, system.displayName(), system.entityTypes());
    }
}
