package org.salesintel.adapters;

import org.salesintel.models.dto.CanonicalFieldSchema;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

public interface CanonicalSchemaProvider {
    /**
     * @throws org.salesintel.exception.SchemaProviderException when the provider cannot answer
     */
    CanonicalFieldSchema fetch(EntityType entity, SourceSystem system);

    boolean supports(EntityType entity, SourceSystem system);
}
