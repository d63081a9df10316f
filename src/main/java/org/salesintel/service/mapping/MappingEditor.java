package org.salesintel.service.mapping;

import lombok.Getter;
import org.salesintel.exception.EditorStateException;
import org.salesintel.exception.MappingValidationException;
import org.salesintel.models.dto.CanonicalFieldDefinition;
import org.salesintel.models.dto.CanonicalFieldSchema;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.MappingDraft;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.dto.MappingWarning;
import org.salesintel.models.dto.SourceFieldDefinition;
import org.salesintel.models.dto.SourceFieldSchema;
import org.salesintel.models.enums.EditorState;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.FieldDataType;
import org.salesintel.models.enums.Provenance;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.models.enums.WarningKind;
import org.salesintel.service.transform.TransformCompatibility;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory editing of one mapping set. At most one entry is edited at a time through a draft;
 * the underlying entry only changes when the draft is committed.
 *
 * <p>Not thread-safe. Callers serialize access per editor.</p>
 */
public class MappingEditor {

    @Getter
    private final SourceSystem system;
    @Getter
    private final EntityType entity;
    @Getter
    private final SourceFieldSchema sourceSchema;
    @Getter
    private final CanonicalFieldSchema canonicalSchema;

    private final List<FieldMapping> entries;

    @Getter
    private EditorState state = EditorState.IDLE;
    private int editingIndex = -1;
    @Getter
    private MappingDraft draft;
    private boolean dirty;

    public MappingEditor(MappingSet initial, SourceFieldSchema sourceSchema, CanonicalFieldSchema canonicalSchema) {
        Objects.requireNonNull(initial, "initial");
        this.system = initial.system();
        this.entity = initial.entity();
        this.sourceSchema = sourceSchema == null ? SourceFieldSchema.empty(system, entity) : sourceSchema;
        this.canonicalSchema = canonicalSchema == null ? CanonicalFieldSchema.empty(entity) : canonicalSchema;
        this.entries = new ArrayList<>(initial.entries());
    }

    public int addDraftEntry() {
        requireIdle("add an entry");
        entries.add(FieldMapping.blankDraft());
        dirty = true;
        int index = entries.size() - 1;
        enterEditing(index);
        return index;
    }

    public void beginEdit(int index) {
        requireIdle("edit entry " + index);
        checkIndex(index);
        enterEditing(index);
    }

    public void updateDraft(MappingDraft changes) {
        requireEditing("update the draft");
        draft = changes == null ? MappingDraft.from(FieldMapping.blankDraft()) : changes;
    }

    /**
     * Validates the draft and writes it into the edited entry.
     *
     * @return transform/type warnings for the committed entry; they never block the commit
     * @throws MappingValidationException listing every problem; the editor stays in edit mode
     */
    public List<MappingWarning> commitEdit() {
        requireEditing("commit");
        List<String> errors = validateDraft();
        if (!errors.isEmpty()) {
            throw new MappingValidationException(errors);
        }
        double confidence = draft.confidence() == null ? FieldMapping.MANUAL_CONFIDENCE : draft.confidence();
        FieldMapping committed = FieldMapping.of(draft.sourceField(), draft.targetField(), draft.transform(),
                confidence, Provenance.MANUAL);
        int index = editingIndex;
        entries.set(index, committed);
        dirty = true;
        leaveEditing();
        return warningsFor(index, committed);
    }

    public void cancelEdit() {
        if (state == EditorState.EDITING) {
            leaveEditing();
        }
    }

    public FieldMapping removeEntry(int index) {
        checkIndex(index);
        if (state == EditorState.EDITING) {
            if (index == editingIndex) {
                leaveEditing();
            } else if (index < editingIndex) {
                editingIndex--;
            }
        }
        dirty = true;
        return entries.remove(index);
    }

    public void replaceAll(List<FieldMapping> replacement) {
        List<FieldMapping> copy = replacement == null ? List.of() : List.copyOf(replacement);
        if (state == EditorState.EDITING) {
            leaveEditing();
        }
        entries.clear();
        entries.addAll(copy);
        dirty = true;
    }

    public MappingSet snapshot() {
        return new MappingSet(system, entity, entries);
    }

    public List<FieldMapping> entries() {
        return List.copyOf(entries);
    }

    public Integer getEditingIndex() {
        return state == EditorState.EDITING ? editingIndex : null;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markSaved() {
        dirty = false;
    }

    private List<String> validateDraft() {
        List<String> errors = new ArrayList<>();
        if (draft.sourceField().isEmpty()) {
            errors.add("Source field is required");
        } else if (!sourceSchema.contains(draft.sourceField())) {
            errors.add("Source field '" + draft.sourceField() + "' is not in the " + system.wireName() + "/"
                    + entity.wireName() + " schema");
        }
        if (draft.targetField().isEmpty()) {
            errors.add("Target field is required");
        } else if (!canonicalSchema.contains(draft.targetField())) {
            errors.add("Target field '" + draft.targetField() + "' is not in the canonical " + entity.wireName()
                    + " schema");
        }
        Double confidence = draft.confidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            errors.add("Confidence must be between 0.0 and 1.0");
        }
        return errors;
    }

    private List<MappingWarning> warningsFor(int index, FieldMapping mapping) {
        List<MappingWarning> warnings = new ArrayList<>();
        FieldDataType sourceType = sourceSchema.find(mapping.sourceField()).map(SourceFieldDefinition::type).orElse(null);
        FieldDataType targetType = canonicalSchema.find(mapping.targetField()).map(CanonicalFieldDefinition::type).orElse(null);
        Optional<String> incompatible = TransformCompatibility.check(mapping.transform(), sourceType, targetType);
        incompatible.ifPresent(message ->
                warnings.add(MappingWarning.forEntry(index, mapping, WarningKind.INCOMPATIBLE_TRANSFORM, message)));
        for (int i = 0; i < entries.size(); i++) {
            if (i != index && entries.get(i).targetField().equals(mapping.targetField())) {
                warnings.add(MappingWarning.forEntry(index, mapping, WarningKind.DUPLICATE_TARGET,
                        "Target field '" + mapping.targetField() + "' is also mapped by entry " + i));
            }
        }
        return warnings;
    }

    private void enterEditing(int index) {
        state = EditorState.EDITING;
        editingIndex = index;
        draft = MappingDraft.from(entries.get(index));
    }

    private void leaveEditing() {
        state = EditorState.IDLE;
        editingIndex = -1;
        draft = null;
    }

    private void requireIdle(String action) {
        if (state == EditorState.EDITING) {
            throw new EditorStateException("Cannot " + action + " while entry " + editingIndex
                    + " is being edited; commit or cancel it first");
        }
    }

    private void requireEditing(String action) {
        if (state != EditorState.EDITING) {
            throw new EditorStateException("Cannot " + action + ": no entry is being edited");
        }
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= entries.size()) {
            throw new IllegalArgumentException("Entry index " + index + " is out of range (0.." + (entries.size() - 1) + ")");
        }
    }
}
