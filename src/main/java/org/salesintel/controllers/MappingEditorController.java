package org.salesintel.controllers;

import jakarta.validation.Valid;
import org.salesintel.models.dto.AutoMapResult;
import org.salesintel.models.dto.EditorSessionView;
import org.salesintel.models.dto.MappingCoverage;
import org.salesintel.models.dto.MappingDraft;
import org.salesintel.models.dto.MappingPreview;
import org.salesintel.models.dto.MappingWarning;
import org.salesintel.models.dto.PreviewRequest;
import org.salesintel.models.dto.SaveResult;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.service.mapping.MappingEditorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/mapping-editor/sessions")
public class MappingEditorController {
    private final MappingEditorService mappingEditorService;

    public MappingEditorController(MappingEditorService mappingEditorService) {
        this.mappingEditorService = mappingEditorService;
    }

    @PostMapping
    public ResponseEntity<EditorSessionView> openSession(@RequestParam("system") SourceSystem system,
                                                         @RequestParam("entity") EntityType entity) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mappingEditorService.open(system, entity));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<EditorSessionView> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(mappingEditorService.view(sessionId));
    }

    @PostMapping("/{sessionId}/entries")
    public ResponseEntity<EditorSessionView> addEntry(@PathVariable String sessionId) {
        return ResponseEntity.ok(mappingEditorService.addEntry(sessionId));
    }

    @PostMapping("/{sessionId}/entries/{index}/edit")
    public ResponseEntity<EditorSessionView> beginEdit(@PathVariable String sessionId, @PathVariable int index) {
        return ResponseEntity.ok(mappingEditorService.beginEdit(sessionId, index));
    }

    @DeleteMapping("/{sessionId}/entries/{index}")
    public ResponseEntity<EditorSessionView> removeEntry(@PathVariable String sessionId, @PathVariable int index) {
        return ResponseEntity.ok(mappingEditorService.removeEntry(sessionId, index));
    }

    @PutMapping("/{sessionId}/draft")
    public ResponseEntity<EditorSessionView> updateDraft(@PathVariable String sessionId, @RequestBody MappingDraft draft) {
        return ResponseEntity.ok(mappingEditorService.updateDraft(sessionId, draft));
    }

    @PostMapping("/{sessionId}/draft/commit")
    public ResponseEntity<List<MappingWarning>> commitEdit(@PathVariable String sessionId) {
        return ResponseEntity.ok(mappingEditorService.commitEdit(sessionId));
    }

    @DeleteMapping("/{sessionId}/draft")
    public ResponseEntity<EditorSessionView> cancelEdit(@PathVariable String sessionId) {
        return ResponseEntity.ok(mappingEditorService.cancelEdit(sessionId));
    }

    @PostMapping("/{sessionId}/auto-map")
    public ResponseEntity<AutoMapResult> autoMap(@PathVariable String sessionId) {
        return ResponseEntity.ok(mappingEditorService.autoMap(sessionId));
    }

    @PostMapping("/{sessionId}/defaults")
    public ResponseEntity<AutoMapResult> applyDefaults(@PathVariable String sessionId) {
        return ResponseEntity.ok(mappingEditorService.applyDefaults(sessionId));
    }

    @GetMapping("/{sessionId}/warnings")
    public ResponseEntity<List<MappingWarning>> getWarnings(@PathVariable String sessionId) {
        return ResponseEntity.ok(mappingEditorService.warnings(sessionId));
    }

    @GetMapping("/{sessionId}/coverage")
    public ResponseEntity<MappingCoverage> getCoverage(@PathVariable String sessionId) {
        return ResponseEntity.ok(mappingEditorService.coverage(sessionId));
    }

    @PostMapping("/{sessionId}/preview")
    public ResponseEntity<MappingPreview> preview(@PathVariable String sessionId,
                                                  @Valid @RequestBody PreviewRequest request) {
        return ResponseEntity.ok(mappingEditorService.preview(sessionId, request.record()));
    }

    @PostMapping("/{sessionId}/save")
    public ResponseEntity<SaveResult> save(@PathVariable String sessionId) {
        return ResponseEntity.ok(mappingEditorService.save(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        mappingEditorService.close(sessionId);
        return ResponseEntity.noContent().build();
    }
}
