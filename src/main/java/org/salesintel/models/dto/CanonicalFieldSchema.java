package org.salesintel.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.salesintel.models.enums.EntityType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record CanonicalFieldSchema(EntityType entity, List<CanonicalFieldDefinition> fields) {

    public CanonicalFieldSchema {
        Map<String, CanonicalFieldDefinition> unique = new LinkedHashMap<>();
        if (fields != null) {
            for (CanonicalFieldDefinition field : fields) {
                unique.putIfAbsent(field.name(), field);
            }
        }
        fields = List.copyOf(unique.values());
    }

    public static CanonicalFieldSchema empty(EntityType entity) {
        return new CanonicalFieldSchema(entity, List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public boolean contains(String fieldName) {
        return find(fieldName).isPresent();
    }

    public Optional<CanonicalFieldDefinition> find(String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        return fields.stream().filter(field -> field.name().equals(fieldName)).findFirst();
    }

    @JsonIgnore
    public List<String> fieldNames() {
        return fields.stream().map(CanonicalFieldDefinition::name).toList();
    }

    @JsonIgnore
    public List<String> requiredFieldNames() {
        return fields.stream()
                .filter(CanonicalFieldDefinition::required)
                .map(CanonicalFieldDefinition::name)
                .toList();
    }
}
