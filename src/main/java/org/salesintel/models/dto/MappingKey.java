package org.salesintel.models.dto;

import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

import java.util.Objects;

public record MappingKey(SourceSystem system, EntityType entity) {

    public MappingKey {
        Objects.requireNonNull(system, "system");
        Objects.requireNonNull(entity, "entity");
    }

    @Override
    public String toString() {
        return system.wireName() + "/" + entity.wireName();
    }
}
