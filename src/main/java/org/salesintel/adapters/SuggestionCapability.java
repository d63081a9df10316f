package org.salesintel.adapters;

import org.salesintel.models.dto.CanonicalFieldSchema;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.SourceFieldSchema;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

import java.util.List;

/**
 * Opaque mapping suggester (LLM-backed in production). An empty list is a valid answer; any
 * failure to answer is reported as {@link org.salesintel.exception.SuggestionUnavailableException}.
 */
public interface SuggestionCapability {
    List<FieldMapping> suggest(SourceSystem system,
                               EntityType entity,
                               SourceFieldSchema sourceSchema,
                               CanonicalFieldSchema canonicalSchema);
}
