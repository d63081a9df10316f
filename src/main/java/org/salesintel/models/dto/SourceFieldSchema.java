package org.salesintel.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fields an external system declares for one entity type, in provider order. Field names are
 * unique; the first declaration wins.
 */
public record SourceFieldSchema(SourceSystem system, EntityType entity, List<SourceFieldDefinition> fields) {

    public SourceFieldSchema {
        Map<String, SourceFieldDefinition> unique = new LinkedHashMap<>();
        if (fields != null) {
            for (SourceFieldDefinition field : fields) {
                unique.putIfAbsent(field.name(), field);
            }
        }
        fields = List.copyOf(unique.values());
    }

    public static SourceFieldSchema empty(SourceSystem system, EntityType entity) {
        return new SourceFieldSchema(system, entity, List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public boolean contains(String fieldName) {
        return find(fieldName).isPresent();
    }

    public Optional<SourceFieldDefinition> find(String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        return fields.stream().filter(field -> field.name().equals(fieldName)).findFirst();
    }

    @JsonIgnore
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        fields.forEach(field -> names.add(field.name()));
        return names;
    }
}
