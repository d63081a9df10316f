package org.salesintel.repository;

import org.salesintel.models.entity.FieldMappingSetRecord;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface FieldMappingSetRepository extends JpaRepository<FieldMappingSetRecord, Long> {

    Optional<FieldMappingSetRecord> findBySourceSystemAndEntityType(SourceSystem sourceSystem, EntityType entityType);
}
