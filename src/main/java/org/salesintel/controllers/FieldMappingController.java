package org.salesintel.controllers;

import jakarta.validation.Valid;
import org.salesintel.models.dto.MappingCoverage;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.dto.MappingWarning;
import org.salesintel.models.dto.SaveMappingRequest;
import org.salesintel.models.dto.SaveResult;
import org.salesintel.models.dto.SchemaResponse;
import org.salesintel.models.dto.SupportedSystemView;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.service.FieldMappingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/mappings")
public class FieldMappingController {
    private final FieldMappingService fieldMappingService;

    public FieldMappingController(FieldMappingService fieldMappingService) {
        this.fieldMappingService = fieldMappingService;
    }

    @GetMapping("/systems")
    public ResponseEntity<List<SupportedSystemView>> getSystems() {
        return ResponseEntity.ok(fieldMappingService.getSupportedSystems());
    }

    @GetMapping("/{system}/{entity}/schema")
    public ResponseEntity<SchemaResponse> getSchemas(@PathVariable SourceSystem system, @PathVariable EntityType entity) {
        return ResponseEntity.ok(fieldMappingService.getSchemas(system, entity));
    }

    @GetMapping("/{system}/{entity}")
    public ResponseEntity<MappingSet> getMappingSet(@PathVariable SourceSystem system, @PathVariable EntityType entity) {
        return ResponseEntity.ok(fieldMappingService.getMappingSet(system, entity));
    }

    @PutMapping("/{system}/{entity}")
    public ResponseEntity<SaveResult> replaceMappingSet(@PathVariable SourceSystem system,
                                                        @PathVariable EntityType entity,
                                                        @Valid @RequestBody SaveMappingRequest request) {
        return ResponseEntity.ok(fieldMappingService.replaceMappingSet(system, entity, request.mappings()));
    }

    @GetMapping("/{system}/{entity}/warnings")
    public ResponseEntity<List<MappingWarning>> getWarnings(@PathVariable SourceSystem system,
                                                            @PathVariable EntityType entity) {
        return ResponseEntity.ok(fieldMappingService.getWarnings(system, entity));
    }

    @GetMapping("/{system}/{entity}/coverage")
    public ResponseEntity<MappingCoverage> getCoverage(@PathVariable SourceSystem system,
                                                       @PathVariable EntityType entity) {
        return ResponseEntity.ok(fieldMappingService.getCoverage(system, entity));
    }
}
