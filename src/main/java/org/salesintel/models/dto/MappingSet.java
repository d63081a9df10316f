package org.salesintel.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

import java.util.List;
import java.util.Objects;

/**
 * Ordered field mappings for one (source system, entity type) pair. Immutable: the editor works
 * on its own copy and hands out snapshots.
 */
public record MappingSet(SourceSystem system, EntityType entity, List<FieldMapping> entries) {

    public MappingSet {
        Objects.requireNonNull(system, "system");
        Objects.requireNonNull(entity, "entity");
        if (entries != null && entries.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Mapping set for " + system + "/" + entity + " contains a null entry");
        }
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static MappingSet empty(SourceSystem system, EntityType entity) {
        return new MappingSet(system, entity, List.of());
    }

    @JsonIgnore
    public MappingKey key() {
        return new MappingKey(system, entity);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
