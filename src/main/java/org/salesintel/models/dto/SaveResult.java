package org.salesintel.models.dto;

import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

public record SaveResult(SourceSystem system, EntityType entity, int count, String status) {

    public static SaveResult saved(MappingSet set) {
        return new SaveResult(set.system(), set.entity(), set.size(), "saved");
    }
}
