package org.salesintel.adapters;

import org.salesintel.models.dto.SourceFieldSchema;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

public interface SourceSchemaProvider {
    /**
     * @throws org.salesintel.exception.SchemaProviderException when the provider cannot answer
     */
    SourceFieldSchema fetch(SourceSystem system, EntityType entity);

    boolean supports(SourceSystem system, EntityType entity);
}
