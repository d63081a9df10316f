package org.salesintel.service.mapping;

import org.junit.jupiter.api.Test;
import org.salesintel.models.dto.CanonicalFieldSchema;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.MappingCoverage;
import org.salesintel.models.dto.MappingPreview;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.dto.MappingWarning;
import org.salesintel.models.dto.SourceFieldSchema;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.Provenance;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.models.enums.TransformType;
import org.salesintel.models.enums.WarningKind;
import org.salesintel.service.schema.DefaultSchemaCatalog;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MappingSetServiceTest {

    private final MappingSetService mappingSetService = new MappingSetService();
    private final DefaultSchemaCatalog catalog = new DefaultSchemaCatalog();
    private final SourceFieldSchema sourceSchema = catalog.sourceSchema(SourceSystem.ODOO, EntityType.OPPORTUNITY);
    private final CanonicalFieldSchema canonicalSchema = catalog.canonicalSchema(EntityType.OPPORTUNITY);

    @Test
    public void testValidate_FlagsEveryProblemWithoutThrowing() {
        MappingSet set = opportunitySet(
                FieldMapping.of("name", "name", TransformType.NONE, 1.0, Provenance.MANUAL),
                FieldMapping.of("", "description", TransformType.NONE, 0.5, Provenance.MANUAL),
                FieldMapping.of("x_legacy_code", "name", TransformType.NONE, 0.8, Provenance.AI_SUGGESTED),
                FieldMapping.of("description", "notes", TransformType.NONE, 0.8, Provenance.AI_SUGGESTED),
                FieldMapping.of("probability", "probability", TransformType.EXTRACT_ID, 0.8, Provenance.AI_SUGGESTED));

        List<MappingWarning> warnings = mappingSetService.validate(set, sourceSchema, canonicalSchema);

        assertEquals(List.of(
                WarningKind.EMPTY_FIELD,
                WarningKind.UNKNOWN_SOURCE_FIELD,
                WarningKind.DUPLICATE_TARGET,
                WarningKind.UNKNOWN_TARGET_FIELD,
                WarningKind.INCOMPATIBLE_TRANSFORM), warnings.stream().map(MappingWarning::kind).toList());
        assertEquals(2, warnings.get(2).index());
    }

    @Test
    public void testValidate_DirectCopyOfReferenceWarns() {
        MappingSet set = opportunitySet(FieldMapping.of("partner_id", "partner_name", TransformType.NONE, 0.9, Provenance.MANUAL));

        List<MappingWarning> warnings = mappingSetService.validate(set, sourceSchema, canonicalSchema);

        assertEquals(1, warnings.size());
        assertEquals(WarningKind.INCOMPATIBLE_TRANSFORM, warnings.get(0).kind());
    }

    @Test
    public void testCoverage_ReportsUnmappedAndRequired() {
        MappingSet set = opportunitySet(
                FieldMapping.of("partner_id", "partner_name", TransformType.EXTRACT_NAME, 0.95, Provenance.DEFAULT),
                FieldMapping.of("partner_id", "partner_id", TransformType.EXTRACT_ID, 0.95, Provenance.DEFAULT),
                FieldMapping.of("user_id", "partner_name", TransformType.EXTRACT_NAME, 0.4, Provenance.MANUAL),
                FieldMapping.blankDraft());

        MappingCoverage coverage = mappingSetService.coverage(set, sourceSchema, canonicalSchema);

        assertEquals(3, coverage.mappedCount());
        assertFalse(coverage.unmappedSourceFields().contains("partner_id"));
        assertTrue(coverage.unmappedSourceFields().contains("stage_id"));
        assertTrue(coverage.unmappedTargetFields().contains("name"));
        assertEquals(List.of("name"), coverage.missingRequiredTargets());
        assertEquals(List.of("partner_name"), coverage.duplicateTargets());
    }

    @Test
    public void testPreview_AppliesTransformsInOrder() {
        MappingSet set = opportunitySet(
                FieldMapping.of("name", "name", TransformType.NONE, 1.0, Provenance.DEFAULT),
                FieldMapping.of("partner_id", "partner_name", TransformType.EXTRACT_NAME, 0.95, Provenance.DEFAULT),
                FieldMapping.of("partner_id", "partner_id", TransformType.EXTRACT_ID, 0.95, Provenance.DEFAULT),
                FieldMapping.of("expected_revenue", "expected_revenue", TransformType.TO_FLOAT, 1.0, Provenance.DEFAULT),
                FieldMapping.of("create_date", "create_date", TransformType.DATE_PARSE, 1.0, Provenance.DEFAULT));
        Map<String, Object> record = Map.of(
                "name", "Website redesign",
                "partner_id", List.of(14, "Azure Interior"),
                "expected_revenue", "48000.00",
                "create_date", "2024-05-02 09:15:00");

        MappingPreview preview = mappingSetService.preview(set, record);

        assertTrue(preview.warnings().isEmpty());
        assertEquals("Website redesign", preview.values().get("name"));
        assertEquals("Azure Interior", preview.values().get("partner_name"));
        assertEquals(14, preview.values().get("partner_id"));
        assertEquals(48000.0, preview.values().get("expected_revenue"));
        assertEquals("2024-05-02T09:15:00Z", preview.values().get("create_date"));
    }

    @Test
    public void testPreview_FailuresBecomeWarningsAndDoNotStopTheRun() {
        MappingSet set = opportunitySet(
                FieldMapping.of("stage_id", "stage_name", TransformType.EXTRACT_NAME, 0.95, Provenance.DEFAULT),
                FieldMapping.of("date_deadline", "date_deadline", TransformType.NONE, 1.0, Provenance.DEFAULT),
                FieldMapping.of("description", "description", TransformType.NONE, 1.0, Provenance.DEFAULT));
        Map<String, Object> record = new HashMap<>();
        record.put("stage_id", false);
        record.put("description", null);

        MappingPreview preview = mappingSetService.preview(set, record);

        assertEquals(List.of(WarningKind.TRANSFORM_FAILED, WarningKind.MISSING_SOURCE_VALUE),
                preview.warnings().stream().map(MappingWarning::kind).toList());
        assertTrue(preview.values().containsKey("description"));
        assertNull(preview.values().get("description"));
        assertFalse(preview.values().containsKey("stage_name"));
    }

    @Test
    public void testPreview_OutOfRangeIntegerDoesNotStopLaterEntries() {
        MappingSet set = opportunitySet(
                FieldMapping.of("probability", "probability", TransformType.TO_INT, 0.9, Provenance.DEFAULT),
                FieldMapping.of("name", "name", TransformType.NONE, 1.0, Provenance.DEFAULT));

        MappingPreview preview = mappingSetService.preview(set, Map.of("probability", "1e999999999", "name", "Deal"));

        assertEquals(1, preview.warnings().size());
        assertEquals(WarningKind.TRANSFORM_FAILED, preview.warnings().get(0).kind());
        assertEquals(0, preview.warnings().get(0).index());
        assertEquals("Deal", preview.values().get("name"));
        assertFalse(preview.values().containsKey("probability"));
    }

    @Test
    public void testPreview_LastAppliedWinsForDuplicateTargets() {
        MappingSet set = opportunitySet(
                FieldMapping.of("name", "name", TransformType.NONE, 1.0, Provenance.DEFAULT),
                FieldMapping.of("description", "name", TransformType.NONE, 0.6, Provenance.MANUAL));

        MappingPreview preview = mappingSetService.preview(set, Map.of("name", "First", "description", "Second"));

        assertEquals("Second", preview.values().get("name"));
        assertEquals(1, preview.warnings().size());
        assertEquals(WarningKind.DUPLICATE_TARGET, preview.warnings().get(0).kind());
        assertEquals(1, preview.warnings().get(0).index());
    }

    private MappingSet opportunitySet(FieldMapping... entries) {
        return new MappingSet(SourceSystem.ODOO, EntityType.OPPORTUNITY, List.of(entries));
    }
}
