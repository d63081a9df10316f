package org.salesintel.service.mapping;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.salesintel.exception.EditorStateException;
import org.salesintel.exception.MappingValidationException;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.MappingDraft;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.dto.MappingWarning;
import org.salesintel.models.enums.EditorState;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.Provenance;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.models.enums.TransformType;
import org.salesintel.models.enums.WarningKind;
import org.salesintel.service.schema.DefaultSchemaCatalog;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MappingEditorTest {

    private final DefaultSchemaCatalog catalog = new DefaultSchemaCatalog();
    private MappingEditor editor;

    @BeforeEach
    public void setUp() {
        MappingSet initial = new MappingSet(SourceSystem.ODOO, EntityType.ACCOUNT, List.of(
                FieldMapping.of("name", "name", TransformType.NONE, 1.0, Provenance.DEFAULT),
                FieldMapping.of("email", "email", TransformType.NONE, 1.0, Provenance.DEFAULT),
                FieldMapping.of("country_id", "country_name", TransformType.EXTRACT_NAME, 0.95, Provenance.AI_SUGGESTED)));
        editor = new MappingEditor(initial,
                catalog.sourceSchema(SourceSystem.ODOO, EntityType.ACCOUNT),
                catalog.canonicalSchema(EntityType.ACCOUNT));
    }

    @Test
    public void testAddDraftEntry_AppendsBlankEntryInEditMode() {
        int index = editor.addDraftEntry();

        assertEquals(3, index);
        assertEquals(EditorState.EDITING, editor.getState());
        assertEquals(3, editor.getEditingIndex());
        FieldMapping blank = editor.entries().get(3);
        assertEquals("", blank.sourceField());
        assertEquals(0.5, blank.confidence());
        assertEquals(Provenance.MANUAL, blank.provenance());
        assertTrue(editor.isDirty());
    }

    @Test
    public void testBeginEdit_WhileEditingIsRejectedAndStateKept() {
        editor.beginEdit(0);

        assertThrows(EditorStateException.class, () -> editor.beginEdit(1));
        assertThrows(EditorStateException.class, () -> editor.addDraftEntry());
        assertEquals(0, editor.getEditingIndex());
        assertEquals("name", editor.getDraft().sourceField());
    }

    @Test
    public void testBeginEdit_BadIndex() {
        assertThrows(IllegalArgumentException.class, () -> editor.beginEdit(3));
        assertThrows(IllegalArgumentException.class, () -> editor.beginEdit(-1));
        assertEquals(EditorState.IDLE, editor.getState());
    }

    @Test
    public void testCommitEdit_MarksManualWithFullConfidence() {
        editor.beginEdit(2);
        editor.updateDraft(new MappingDraft("state_id", "state_name", TransformType.EXTRACT_NAME, null));

        List<MappingWarning> warnings = editor.commitEdit();

        assertTrue(warnings.isEmpty());
        FieldMapping committed = editor.entries().get(2);
        assertEquals("state_id", committed.sourceField());
        assertEquals(Provenance.MANUAL, committed.provenance());
        assertEquals(1.0, committed.confidence());
        assertEquals(EditorState.IDLE, editor.getState());
        assertNull(editor.getDraft());
    }

    @Test
    public void testCommitEdit_DraftConfidenceOverride() {
        editor.beginEdit(0);
        editor.updateDraft(new MappingDraft("name", "name", TransformType.NONE, 0.7));

        editor.commitEdit();

        assertEquals(0.7, editor.entries().get(0).confidence());
    }

    @Test
    public void testCommitEdit_EmptyFieldsReportEveryProblem() {
        editor.addDraftEntry();

        MappingValidationException e = assertThrows(MappingValidationException.class, () -> editor.commitEdit());

        assertEquals(2, e.getErrors().size());
        assertEquals(EditorState.EDITING, editor.getState());
        assertEquals(4, editor.entries().size());
    }

    @Test
    public void testCommitEdit_UnknownFieldsAreRejectedAndSetUnchanged() {
        editor.beginEdit(1);
        editor.updateDraft(new MappingDraft("mobile", "mobile_phone", TransformType.NONE, null));

        MappingValidationException e = assertThrows(MappingValidationException.class, () -> editor.commitEdit());

        assertEquals(2, e.getErrors().size());
        assertTrue(e.getErrors().get(0).contains("mobile"));
        assertEquals("email", editor.entries().get(1).sourceField());
        assertEquals(EditorState.EDITING, editor.getState());
    }

    @Test
    public void testCommitEdit_WhileIdleIsRejected() {
        assertThrows(EditorStateException.class, () -> editor.commitEdit());
    }

    @Test
    public void testCommitEdit_ReturnsCompatibilityWarning() {
        editor.beginEdit(0);
        editor.updateDraft(new MappingDraft("phone", "phone", TransformType.EXTRACT_ID, null));

        List<MappingWarning> warnings = editor.commitEdit();

        assertEquals(1, warnings.size());
        assertEquals(WarningKind.INCOMPATIBLE_TRANSFORM, warnings.get(0).kind());
        assertEquals(TransformType.EXTRACT_ID, editor.entries().get(0).transform());
    }

    @Test
    public void testCommitEdit_DuplicateTargetIsAllowedWithWarning() {
        editor.beginEdit(1);
        editor.updateDraft(new MappingDraft("website", "name", TransformType.NONE, null));

        List<MappingWarning> warnings = editor.commitEdit();

        assertEquals(WarningKind.DUPLICATE_TARGET, warnings.get(0).kind());
        assertEquals("name", editor.entries().get(1).targetField());
    }

    @Test
    public void testCancelEdit_LeavesSetUnchanged() {
        editor.beginEdit(0);
        editor.updateDraft(new MappingDraft("phone", "phone", TransformType.NONE, null));

        editor.cancelEdit();

        assertEquals("name", editor.entries().get(0).sourceField());
        assertEquals(EditorState.IDLE, editor.getState());
        assertFalse(editor.isDirty());
    }

    @Test
    public void testCancelEdit_KeepsBlankEntryFromAdd() {
        editor.addDraftEntry();
        editor.cancelEdit();

        assertEquals(4, editor.entries().size());
        assertEquals(EditorState.IDLE, editor.getState());
    }

    @Test
    public void testRemoveEntry_BeforeEditedEntryShiftsIndex() {
        editor.beginEdit(2);

        editor.removeEntry(0);

        assertEquals(1, editor.getEditingIndex());
        assertEquals("country_id", editor.getDraft().sourceField());
        editor.commitEdit();
        assertEquals("country_id", editor.entries().get(1).sourceField());
    }

    @Test
    public void testRemoveEntry_EditedEntryDiscardsDraft() {
        editor.beginEdit(1);

        FieldMapping removed = editor.removeEntry(1);

        assertEquals("email", removed.sourceField());
        assertEquals(EditorState.IDLE, editor.getState());
        assertEquals(2, editor.entries().size());
    }

    @Test
    public void testReplaceAll_OverwritesAndDiscardsDraft() {
        editor.beginEdit(0);

        editor.replaceAll(List.of(FieldMapping.of("zip", "zip", TransformType.NONE, 0.9, Provenance.AI_SUGGESTED)));

        assertEquals(EditorState.IDLE, editor.getState());
        assertEquals(1, editor.snapshot().size());
        assertEquals("zip", editor.snapshot().entries().get(0).targetField());
    }

    @Test
    public void testMarkSaved_ClearsDirtyFlag() {
        editor.removeEntry(0);
        assertTrue(editor.isDirty());

        editor.markSaved();

        assertFalse(editor.isDirty());
    }
}
