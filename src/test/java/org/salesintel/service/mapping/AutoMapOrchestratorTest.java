package org.salesintel.service.mapping;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.salesintel.adapters.SuggestionCapability;
import org.salesintel.exception.SuggestionUnavailableException;
import org.salesintel.models.dto.AutoMapResult;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.enums.AutoMapOutcome;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.Provenance;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.models.enums.TransformType;
import org.salesintel.service.schema.DefaultSchemaCatalog;
import org.salesintel.service.schema.SchemaRegistry;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class AutoMapOrchestratorTest {

    @Mock
    private SuggestionCapability suggestionCapability;

    @Mock
    private SchemaRegistry schemaRegistry;

    private final DefaultSchemaCatalog catalog = new DefaultSchemaCatalog();
    private AutoMapOrchestrator orchestrator;
    private MappingEditor editor;

    @BeforeEach
    public void setUp() {
        orchestrator = new AutoMapOrchestrator(suggestionCapability, schemaRegistry, Runnable::run, Duration.ofSeconds(5));
        editor = editorFor(SourceSystem.ODOO, EntityType.ACCOUNT,
                List.of(FieldMapping.of("name", "name", TransformType.NONE, 1.0, Provenance.MANUAL)));
    }

    @Test
    public void testAutoMap_CandidatesReplaceSetAsSuggested() {
        when(suggestionCapability.suggest(eq(SourceSystem.ODOO), eq(EntityType.ACCOUNT), any(), any())).thenReturn(List.of(
                FieldMapping.of("name", "name", TransformType.NONE, 0.98, Provenance.MANUAL),
                FieldMapping.of("email", "email", TransformType.NONE, 0.9, Provenance.MANUAL),
                FieldMapping.of("user_id", "salesperson_name", TransformType.EXTRACT_NAME, 0.6, Provenance.MANUAL)));

        AutoMapResult result = orchestrator.autoMap(editor);

        assertEquals(AutoMapOutcome.SUGGESTED, result.outcome());
        assertEquals(3, result.count());
        assertEquals(3, editor.entries().size());
        editor.entries().forEach(entry -> assertEquals(Provenance.AI_SUGGESTED, entry.provenance()));
        assertEquals(0.6, editor.entries().get(2).confidence());
    }

    @Test
    public void testAutoMap_NullCandidatesAreSkipped() {
        when(suggestionCapability.suggest(any(), any(), any(), any())).thenReturn(Arrays.asList(
                null,
                FieldMapping.of("email", "email", TransformType.NONE, 0.9, Provenance.MANUAL),
                null));

        AutoMapResult result = orchestrator.autoMap(editor);

        assertEquals(AutoMapOutcome.SUGGESTED, result.outcome());
        assertEquals(1, result.count());
        assertEquals("email", editor.entries().get(0).sourceField());
        assertEquals(Provenance.AI_SUGGESTED, editor.entries().get(0).provenance());
    }

    @Test
    public void testAutoMap_OnlyNullCandidatesLeavesSetUnchanged() {
        when(suggestionCapability.suggest(any(), any(), any(), any())).thenReturn(Arrays.asList(null, null));

        AutoMapResult result = orchestrator.autoMap(editor);

        assertEquals(AutoMapOutcome.NO_SUGGESTIONS, result.outcome());
        assertEquals(1, editor.entries().size());
        assertFalse(editor.isDirty());
    }

    @Test
    public void testAutoMap_NoCandidatesLeavesSetUnchanged() {
        when(suggestionCapability.suggest(any(), any(), any(), any())).thenReturn(List.of());

        AutoMapResult result = orchestrator.autoMap(editor);

        assertEquals(AutoMapOutcome.NO_SUGGESTIONS, result.outcome());
        assertEquals(1, editor.entries().size());
        assertFalse(editor.isDirty());
        verify(schemaRegistry, never()).getDefaultMappings(any(), any());
    }

    @Test
    public void testAutoMap_FailureAppliesDefaults() {
        when(suggestionCapability.suggest(any(), any(), any(), any()))
                .thenThrow(new SuggestionUnavailableException("503 from mapping service"));
        MappingSet defaults = new MappingSet(SourceSystem.ODOO, EntityType.ACCOUNT, List.of(
                FieldMapping.of("name", "name", TransformType.NONE, 1.0, Provenance.DEFAULT),
                FieldMapping.of("state_id", "state_name", TransformType.EXTRACT_NAME, 0.95, Provenance.DEFAULT)));
        when(schemaRegistry.getDefaultMappings(SourceSystem.ODOO, EntityType.ACCOUNT)).thenReturn(Optional.of(defaults));

        AutoMapResult result = orchestrator.autoMap(editor);

        assertEquals(AutoMapOutcome.DEFAULTS_APPLIED, result.outcome());
        assertEquals(2, result.count());
        assertEquals(defaults.entries(), editor.entries());
    }

    @Test
    public void testAutoMap_FailureWithoutDefaultsLeavesSetUnchanged() {
        when(suggestionCapability.suggest(any(), any(), any(), any()))
                .thenThrow(new SuggestionUnavailableException("not configured"));
        when(schemaRegistry.getDefaultMappings(any(), any())).thenReturn(Optional.empty());

        AutoMapResult result = orchestrator.autoMap(editor);

        assertEquals(AutoMapOutcome.NO_DEFAULTS, result.outcome());
        assertEquals("name", editor.entries().get(0).sourceField());
        assertEquals(Provenance.MANUAL, editor.entries().get(0).provenance());
    }

    @Test
    public void testAutoMap_TimeoutAppliesDefaults() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            AutoMapOrchestrator slow = new AutoMapOrchestrator(suggestionCapability, schemaRegistry, executor,
                    Duration.ofMillis(100));
            when(suggestionCapability.suggest(any(), any(), any(), any())).thenAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return List.of(FieldMapping.of("name", "name", TransformType.NONE, 1.0, Provenance.AI_SUGGESTED));
            });
            when(schemaRegistry.getDefaultMappings(SourceSystem.ODOO, EntityType.ACCOUNT)).thenReturn(Optional.of(
                    new MappingSet(SourceSystem.ODOO, EntityType.ACCOUNT, List.of(
                            FieldMapping.of("zip", "zip", TransformType.NONE, 1.0, Provenance.DEFAULT)))));

            AutoMapResult result = slow.autoMap(editor);

            assertEquals(AutoMapOutcome.DEFAULTS_APPLIED, result.outcome());
            assertEquals("zip", editor.entries().get(0).sourceField());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    public void testApplyDefaults_UsesRegistryTable() {
        when(schemaRegistry.getDefaultMappings(SourceSystem.MS365, EntityType.USER)).thenReturn(Optional.of(
                new MappingSet(SourceSystem.MS365, EntityType.USER, List.of(
                        FieldMapping.of("mail", "email", TransformType.NONE, 0.95, Provenance.DEFAULT)))));
        MappingEditor ms365 = editorFor(SourceSystem.MS365, EntityType.USER, List.of());

        AutoMapResult result = orchestrator.applyDefaults(ms365);

        assertTrue(result.replacedSet());
        assertEquals(Provenance.DEFAULT, ms365.entries().get(0).provenance());
        verifyNoInteractions(suggestionCapability);
    }

    private MappingEditor editorFor(SourceSystem system, EntityType entity, List<FieldMapping> entries) {
        return new MappingEditor(new MappingSet(system, entity, entries),
                catalog.sourceSchema(system, entity), catalog.canonicalSchema(entity));
    }
}
