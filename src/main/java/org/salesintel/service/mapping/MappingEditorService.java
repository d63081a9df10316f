package org.salesintel.service.mapping;

import lombok.extern.slf4j.Slf4j;
import org.salesintel.adapters.MappingStore;
import org.salesintel.exception.EditorSessionNotFoundException;
import org.salesintel.models.dto.AutoMapResult;
import org.salesintel.models.dto.CanonicalFieldSchema;
import org.salesintel.models.dto.EditorSessionView;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.MappingCoverage;
import org.salesintel.models.dto.MappingDraft;
import org.salesintel.models.dto.MappingEntryView;
import org.salesintel.models.dto.MappingPreview;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.dto.MappingWarning;
import org.salesintel.models.dto.SaveResult;
import org.salesintel.models.dto.SourceFieldSchema;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.service.schema.SchemaRegistry;
import org.salesintel.utils.AppUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Keeps one {@link MappingEditor} per operator session and routes editor operations to it by
 * session id. Sessions idle for longer than the configured TTL are dropped.
 */
@Slf4j
@Service
public class MappingEditorService {

    private final SchemaRegistry schemaRegistry;
    private final MappingStore mappingStore;
    private final AutoMapOrchestrator autoMapOrchestrator;
    private final MappingSetService mappingSetService;
    private final Duration sessionTtl;

    private final Map<String, EditorSession> sessions = new ConcurrentHashMap<>();

    public MappingEditorService(SchemaRegistry schemaRegistry,
                                MappingStore mappingStore,
                                AutoMapOrchestrator autoMapOrchestrator,
                                MappingSetService mappingSetService,
                                @Value("${mapping.editor.session-ttl:PT2H}") Duration sessionTtl) {
        this.schemaRegistry = schemaRegistry;
        this.mappingStore = mappingStore;
        this.autoMapOrchestrator = autoMapOrchestrator;
        this.mappingSetService = mappingSetService;
        this.sessionTtl = sessionTtl;
    }

    public EditorSessionView open(SourceSystem system, EntityType entity) {
        if (!system.supports(entity)) {
            throw new IllegalArgumentException(system.displayName() + " does not provide " + entity.wireName() + " records");
        }
        SourceFieldSchema sourceSchema = schemaRegistry.getSourceSchema(system, entity);
        CanonicalFieldSchema canonicalSchema = schemaRegistry.getCanonicalSchema(entity, system);
        MappingSet persisted = mappingStore.load(system, entity);

        EditorSession session = new EditorSession(AppUtils.generateUUID(),
                new MappingEditor(persisted, sourceSchema, canonicalSchema));
        sessions.put(session.id, session);
        log.info("Opened mapping editor session {} for {}/{} with {} entries",
                session.id, system.wireName(), entity.wireName(), persisted.size());
        return toView(session);
    }

    public EditorSessionView view(String sessionId) {
        return withSession(sessionId, this::toView);
    }

    public EditorSessionView addEntry(String sessionId) {
        return withSession(sessionId, session -> {
            session.editor.addDraftEntry();
            return toView(session);
        });
    }

    public EditorSessionView beginEdit(String sessionId, int index) {
        return withSession(sessionId, session -> {
            session.editor.beginEdit(index);
            return toView(session);
        });
    }

    public EditorSessionView updateDraft(String sessionId, MappingDraft draft) {
        return withSession(sessionId, session -> {
            session.editor.updateDraft(draft);
            return toView(session);
        });
    }

    public List<MappingWarning> commitEdit(String sessionId) {
        return withSession(sessionId, session -> session.editor.commitEdit());
    }

    public EditorSessionView cancelEdit(String sessionId) {
        return withSession(sessionId, session -> {
            session.editor.cancelEdit();
            return toView(session);
        });
    }

    public EditorSessionView removeEntry(String sessionId, int index) {
        return withSession(sessionId, session -> {
            FieldMapping removed = session.editor.removeEntry(index);
            log.debug("Session {} removed entry {} ({} -> {})", sessionId, index,
                    removed.sourceField(), removed.targetField());
            return toView(session);
        });
    }

    public AutoMapResult autoMap(String sessionId) {
        return withSession(sessionId, session -> autoMapOrchestrator.autoMap(session.editor));
    }

    public AutoMapResult applyDefaults(String sessionId) {
        return withSession(sessionId, session -> autoMapOrchestrator.applyDefaults(session.editor));
    }

    public List<MappingWarning> warnings(String sessionId) {
        return withSession(sessionId, session -> mappingSetService.validate(session.editor.snapshot(),
                session.editor.getSourceSchema(), session.editor.getCanonicalSchema()));
    }

    public MappingCoverage coverage(String sessionId) {
        return withSession(sessionId, session -> mappingSetService.coverage(session.editor.snapshot(),
                session.editor.getSourceSchema(), session.editor.getCanonicalSchema()));
    }

    public MappingPreview preview(String sessionId, Map<String, Object> record) {
        return withSession(sessionId, session -> mappingSetService.preview(session.editor.snapshot(), record));
    }

    /**
     * Stores the committed entries, replacing whatever was saved for the pair. An open draft is not
     * part of the save. On failure the session keeps its edits so the save can be retried.
     */
    public SaveResult save(String sessionId) {
        return withSession(sessionId, session -> {
            MappingEditor editor = session.editor;
            MappingSet snapshot = editor.snapshot();
            mappingStore.save(editor.getSystem(), editor.getEntity(), snapshot);
            editor.markSaved();
            log.info("Session {} saved {} mappings for {}", sessionId, snapshot.size(), snapshot.key());
            return SaveResult.saved(snapshot);
        });
    }

    public void close(String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new EditorSessionNotFoundException(sessionId);
        }
        log.info("Closed mapping editor session {}", sessionId);
    }

    @Scheduled(fixedDelayString = "${mapping.editor.eviction-interval:300000}")
    public void evictIdleSessions() {
        evictIdleSessions(Instant.now());
    }

    int evictIdleSessions(Instant now) {
        Instant cutoff = now.minus(sessionTtl);
        List<String> evicted = new ArrayList<>();
        sessions.forEach((id, session) -> {
            if (session.lastAccessedAt.isBefore(cutoff) && sessions.remove(id, session)) {
                evicted.add(id);
            }
        });
        if (!evicted.isEmpty()) {
            log.info("Evicted {} idle mapping editor sessions", evicted.size());
        }
        return evicted.size();
    }

    int sessionCount() {
        return sessions.size();
    }

    private <T> T withSession(String sessionId, Function<EditorSession, T> action) {
        EditorSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new EditorSessionNotFoundException(sessionId);
        }
        synchronized (session) {
            session.lastAccessedAt = Instant.now();
            return action.apply(session);
        }
    }

    private EditorSessionView toView(EditorSession session) {
        MappingEditor editor = session.editor;
        Integer editingIndex = editor.getEditingIndex();
        List<FieldMapping> entries = editor.entries();
        List<MappingEntryView> rows = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            rows.add(MappingEntryView.of(i, entries.get(i), editingIndex != null && editingIndex == i));
        }
        return new EditorSessionView(session.id, editor.getSystem(), editor.getEntity(), editor.getState(),
                editingIndex, editor.getDraft(), rows, editor.isDirty(), session.lastAccessedAt);
    }

    private static final class EditorSession {
        private final String id;
        private final MappingEditor editor;
        private volatile Instant lastAccessedAt = Instant.now();

        private EditorSession(String id, MappingEditor editor) {
            this.id = id;
            this.editor = editor;
        }
    }
}
