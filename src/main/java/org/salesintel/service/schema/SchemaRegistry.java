package org.salesintel.service.schema;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.salesintel.adapters.CanonicalSchemaProvider;
import org.salesintel.adapters.SourceSchemaProvider;
import org.salesintel.models.dto.CanonicalFieldSchema;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.dto.SourceFieldSchema;
import org.salesintel.models.dto.SupportedSystemView;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Single lookup point for schemas and default mapping tables. Live providers are asked on every
 * call; when none answers with fields, the built-in catalog for the pair is returned instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaRegistry {

    private final List<SourceSchemaProvider> sourceProviders;
    private final List<CanonicalSchemaProvider> canonicalProviders;
    private final DefaultSchemaCatalog defaultSchemaCatalog;
    private final DefaultMappingCatalog defaultMappingCatalog;

    public SourceFieldSchema getSourceSchema(SourceSystem system, EntityType entity) {
        for (SourceSchemaProvider provider : sourceProviders) {
            if (!provider.supports(system, entity)) {
                continue;
            }
            try {
                SourceFieldSchema schema = provider.fetch(system, entity);
                if (schema != null && !schema.isEmpty()) {
                    return schema;
                }
                log.warn("Source schema provider {} returned no fields for {}/{}",
                        provider.getClass().getSimpleName(), system.wireName(), entity.wireName());
            } catch (RuntimeException e) {
                log.warn("Source schema provider {} failed for {}/{}: {}",
                        provider.getClass().getSimpleName(), system.wireName(), entity.wireName(), e.getMessage());
            }
        }
        log.debug("Serving default source schema for {}/{}", system.wireName(), entity.wireName());
        return defaultSchemaCatalog.sourceSchema(system, entity);
    }

    public CanonicalFieldSchema getCanonicalSchema(EntityType entity, SourceSystem system) {
        for (CanonicalSchemaProvider provider : canonicalProviders) {
            if (!provider.supports(entity, system)) {
                continue;
            }
            try {
                CanonicalFieldSchema schema = provider.fetch(entity, system);
                if (schema != null && !schema.isEmpty()) {
                    return schema;
                }
                log.warn("Canonical schema provider {} returned no fields for {}",
                        provider.getClass().getSimpleName(), entity.wireName());
            } catch (RuntimeException e) {
                log.warn("Canonical schema provider {} failed for {}: {}",
                        provider.getClass().getSimpleName(), entity.wireName(), e.getMessage());
            }
        }
        log.debug("Serving default canonical schema for {}", entity.wireName());
        return defaultSchemaCatalog.canonicalSchema(entity);
    }

    public Optional<MappingSet> getDefaultMappings(SourceSystem system, EntityType entity) {
        return defaultMappingCatalog.find(system, entity);
    }

    public List<SupportedSystemView> supportedSystems() {
        return Arrays.stream(SourceSystem.values()).map(SupportedSystemView::of).toList();
    }
}
