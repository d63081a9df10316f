package org.salesintel.models.dto;

import org.salesintel.models.enums.EditorState;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

import java.time.Instant;
import java.util.List;

public record EditorSessionView(
        String sessionId,
        SourceSystem system,
        EntityType entity,
        EditorState state,
        Integer editingIndex,
        MappingDraft draft,
        List<MappingEntryView> entries,
        boolean dirty,
        Instant lastAccessedAt
) {
}
