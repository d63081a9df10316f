package org.salesintel.controllers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.salesintel.configuration.WebConfig;
import org.salesintel.exception.EditorSessionNotFoundException;
import org.salesintel.exception.EditorStateException;
import org.salesintel.exception.GlobalExceptionHandler;
import org.salesintel.exception.MappingPersistenceException;
import org.salesintel.exception.MappingValidationException;
import org.salesintel.models.dto.AutoMapResult;
import org.salesintel.models.dto.EditorSessionView;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.MappingDraft;
import org.salesintel.models.dto.MappingEntryView;
import org.salesintel.models.enums.EditorState;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.Provenance;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.models.enums.TransformType;
import org.salesintel.service.mapping.MappingEditorService;
import org.springframework.format.support.DefaultFormattingConversionService;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class MappingEditorControllerTest {

    private static final String SESSIONS = "/api/mapping-editor/sessions";

    @Mock
    private MappingEditorService mappingEditorService;

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        DefaultFormattingConversionService conversionService = new DefaultFormattingConversionService();
        new WebConfig(new String[]{"*"}).addFormatters(conversionService);
        mockMvc = MockMvcBuilders.standaloneSetup(new MappingEditorController(mappingEditorService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setConversionService(conversionService)
                .build();
    }

    @Test
    public void testOpenSession_Created() throws Exception {
        when(mappingEditorService.open(SourceSystem.ODOO, EntityType.ACCOUNT)).thenReturn(sessionView());

        mockMvc.perform(post(SESSIONS).param("system", "odoo").param("entity", "account"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.system").value("odoo"))
                .andExpect(jsonPath("$.state").value("idle"))
                .andExpect(jsonPath("$.entries[0].provenance").value("ai_suggested"))
                .andExpect(jsonPath("$.entries[0].confidenceLevel").value("high"));
    }

    @Test
    public void testOpenSession_UnknownSystemIsBadRequest() throws Exception {
        mockMvc.perform(post(SESSIONS).param("system", "sap").param("entity", "account"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(mappingEditorService);
    }

    @Test
    public void testUpdateDraft_ReadsSnakeCaseBody() throws Exception {
        when(mappingEditorService.updateDraft(anyString(), any(MappingDraft.class))).thenReturn(sessionView());

        mockMvc.perform(put(SESSIONS + "/s-1/draft")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source_field\": \"parent_id\", \"target_field\": \"company_id\", \"transform\": \"extract_id\"}"))
                .andExpect(status().isOk());

        verify(mappingEditorService).updateDraft("s-1",
                new MappingDraft("parent_id", "company_id", TransformType.EXTRACT_ID, null));
    }

    @Test
    public void testCommit_ValidationErrorIsUnprocessable() throws Exception {
        when(mappingEditorService.commitEdit("s-1")).thenThrow(new MappingValidationException(
                List.of("Source field is required", "Target field 'foo' is not in the canonical account schema")));

        mockMvc.perform(post(SESSIONS + "/s-1/draft/commit"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.length()").value(2))
                .andExpect(jsonPath("$.path").value(SESSIONS + "/s-1/draft/commit"));
    }

    @Test
    public void testBeginEdit_WhileEditingIsConflict() throws Exception {
        when(mappingEditorService.beginEdit("s-1", 2)).thenThrow(new EditorStateException("Cannot edit entry 2"));

        mockMvc.perform(post(SESSIONS + "/s-1/entries/2/edit"))
                .andExpect(status().isConflict());
    }

    @Test
    public void testUnknownSessionIsNotFound() throws Exception {
        when(mappingEditorService.view("nope")).thenThrow(new EditorSessionNotFoundException("nope"));

        mockMvc.perform(get(SESSIONS + "/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void testSave_PersistenceFailureIsServiceUnavailable() throws Exception {
        when(mappingEditorService.save("s-1")).thenThrow(new MappingPersistenceException("db down", null));

        mockMvc.perform(post(SESSIONS + "/s-1/save"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    public void testAutoMap_ReturnsOutcome() throws Exception {
        when(mappingEditorService.autoMap("s-1")).thenReturn(AutoMapResult.defaultsApplied(12));

        mockMvc.perform(post(SESSIONS + "/s-1/auto-map"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("defaults_applied"))
                .andExpect(jsonPath("$.count").value(12));
    }

    @Test
    public void testPreview_MissingRecordIsBadRequest() throws Exception {
        mockMvc.perform(post(SESSIONS + "/s-1/preview")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(mappingEditorService);
    }

    @Test
    public void testCloseSession_NoContent() throws Exception {
        mockMvc.perform(delete(SESSIONS + "/s-1"))
                .andExpect(status().isNoContent());

        verify(mappingEditorService).close("s-1");
    }

    private EditorSessionView sessionView() {
        FieldMapping entry = FieldMapping.of("name", "name", TransformType.NONE, 0.93, Provenance.AI_SUGGESTED);
        return new EditorSessionView("s-1", SourceSystem.ODOO, EntityType.ACCOUNT, EditorState.IDLE, null, null,
                List.of(MappingEntryView.of(0, entry, false)), false, Instant.parse("2024-06-01T10:00:00Z"));
    }
}
