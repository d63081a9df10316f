package org.salesintel.adapters;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.salesintel.exception.MappingPersistenceException;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.entity.FieldMappingSetRecord;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.repository.FieldMappingSetRepository;
import org.salesintel.utils.AppUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaMappingStore implements MappingStore {

    private final FieldMappingSetRepository fieldMappingSetRepository;

    @Override
    @Transactional(readOnly = true)
    public MappingSet load(SourceSystem system, EntityType entity) {
        try {
            return fieldMappingSetRepository.findBySourceSystemAndEntityType(system, entity)
                    .map(record -> new MappingSet(system, entity, record.getEntries()))
                    .orElseGet(() -> MappingSet.empty(system, entity));
        } catch (DataAccessException e) {
            log.error("Failed to load mapping set {}/{}", system.wireName(), entity.wireName(), e);
            throw new MappingPersistenceException("Could not load mappings for "
                    + system.wireName() + "/" + entity.wireName(), e);
        }
    }

    @Override
    @Transactional
    public void save(SourceSystem system, EntityType entity, MappingSet mappingSet) {
        Instant now = Instant.now();
        try {
            FieldMappingSetRecord record = fieldMappingSetRepository.findBySourceSystemAndEntityType(system, entity)
                    .orElseGet(() -> FieldMappingSetRecord.builder()
                            .fieldMappingSetUid(AppUtils.generateUUID())
                            .sourceSystem(system)
                            .entityType(entity)
                            .createdAt(now)
                            .build());
            record.setEntries(new ArrayList<>(mappingSet.entries()));
            record.setUpdatedAt(now);
            fieldMappingSetRepository.saveAndFlush(record);
            log.info("Saved {} field mappings for {}/{}", mappingSet.size(), system.wireName(), entity.wireName());
        } catch (DataAccessException e) {
            log.error("Failed to save mapping set {}/{}", system.wireName(), entity.wireName(), e);
            throw new MappingPersistenceException("Could not save mappings for "
                    + system.wireName() + "/" + entity.wireName(), e);
        }
    }
}
