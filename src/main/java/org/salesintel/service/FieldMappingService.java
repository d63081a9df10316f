package org.salesintel.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.salesintel.adapters.MappingStore;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.MappingCoverage;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.dto.MappingWarning;
import org.salesintel.models.dto.SaveResult;
import org.salesintel.models.dto.SchemaResponse;
import org.salesintel.models.dto.SupportedSystemView;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.service.mapping.MappingSetService;
import org.salesintel.service.schema.SchemaRegistry;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Access to saved mapping sets outside an editor session, used by the dashboard's read views and
 * by clients that upload a whole set at once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FieldMappingService {

    private final SchemaRegistry schemaRegistry;
    private final MappingStore mappingStore;
    private final MappingSetService mappingSetService;

    public List<SupportedSystemView> getSupportedSystems() {
        return schemaRegistry.supportedSystems();
    }

    public SchemaResponse getSchemas(SourceSystem system, EntityType entity) {
        return new SchemaResponse(
                schemaRegistry.getSourceSchema(system, entity),
                schemaRegistry.getCanonicalSchema(entity, system));
    }

    public MappingSet getMappingSet(SourceSystem system, EntityType entity) {
        requireAdvertised(system, entity);
        return mappingStore.load(system, entity);
    }

    public SaveResult replaceMappingSet(SourceSystem system, EntityType entity, List<FieldMapping> mappings) {
        requireAdvertised(system, entity);
        MappingSet set = new MappingSet(system, entity, mappings);
        mappingStore.save(system, entity, set);
        log.info("Replaced mapping set {} with {} entries", set.key(), set.size());
        return SaveResult.saved(set);
    }

    public List<MappingWarning> getWarnings(SourceSystem system, EntityType entity) {
        MappingSet set = getMappingSet(system, entity);
        return mappingSetService.validate(set,
                schemaRegistry.getSourceSchema(system, entity),
                schemaRegistry.getCanonicalSchema(entity, system));
    }

    public MappingCoverage getCoverage(SourceSystem system, EntityType entity) {
        MappingSet set = getMappingSet(system, entity);
        return mappingSetService.coverage(set,
                schemaRegistry.getSourceSchema(system, entity),
                schemaRegistry.getCanonicalSchema(entity, system));
    }

    private static void requireAdvertised(SourceSystem system, EntityType entity) {
        if (!system.supports(entity)) {
            throw new IllegalArgumentException(system.displayName() + " does not provide " + entity.wireName() + " records");
        }
    }
}
