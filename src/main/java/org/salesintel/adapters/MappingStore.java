package org.salesintel.adapters;

import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

public interface MappingStore {
    /**
     * @return the persisted set, or an empty set when nothing was saved for the key
     */
    MappingSet load(SourceSystem system, EntityType entity);

    /**
     * Replaces whatever was stored for the key. No merge and no concurrency check: the last
     * writer wins.
     *
     * @throws org.salesintel.exception.MappingPersistenceException when the set cannot be stored
     */
    void save(SourceSystem system, EntityType entity, MappingSet mappingSet);
}
