package org.salesintel.service.mapping;

import lombok.extern.slf4j.Slf4j;
import org.salesintel.adapters.SuggestionCapability;
import org.salesintel.models.dto.AutoMapResult;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.enums.Provenance;
import org.salesintel.service.schema.SchemaRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bulk-populates an editor from the suggestion capability, falling back to the preset mapping
 * table for the pair when suggestions cannot be obtained.
 */
@Slf4j
@Service
public class AutoMapOrchestrator {

    private final SuggestionCapability suggestionCapability;
    private final SchemaRegistry schemaRegistry;
    private final Executor suggestionExecutor;
    private final Duration timeout;

    public AutoMapOrchestrator(SuggestionCapability suggestionCapability,
                               SchemaRegistry schemaRegistry,
                               @Qualifier("suggestionExecutor") Executor suggestionExecutor,
                               @Value("${mapping.suggestion.timeout:PT20S}") Duration timeout) {
        this.suggestionCapability = suggestionCapability;
        this.schemaRegistry = schemaRegistry;
        this.suggestionExecutor = suggestionExecutor;
        this.timeout = timeout;
    }

    public AutoMapResult autoMap(MappingEditor editor) {
        List<FieldMapping> candidates;
        try {
            candidates = requestSuggestions(editor);
        } catch (TimeoutException e) {
            log.warn("Suggestions for {}/{} timed out after {}; applying defaults",
                    editor.getSystem().wireName(), editor.getEntity().wireName(), timeout);
            return applyDefaults(editor);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Suggestions for {}/{} failed: {}; applying defaults",
                    editor.getSystem().wireName(), editor.getEntity().wireName(), cause.getMessage());
            return applyDefaults(editor);
        } catch (RejectedExecutionException e) {
            log.warn("Suggestion pool is saturated; applying defaults for {}/{}",
                    editor.getSystem().wireName(), editor.getEntity().wireName());
            return applyDefaults(editor);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for suggestions for {}/{}; applying defaults",
                    editor.getSystem().wireName(), editor.getEntity().wireName());
            return applyDefaults(editor);
        }

        List<FieldMapping> suggested = candidates == null ? List.of() : candidates.stream()
                .filter(Objects::nonNull)
                .map(candidate -> candidate.withProvenance(Provenance.AI_SUGGESTED))
                .toList();
        if (suggested.isEmpty()) {
            log.info("No suggestions for {}/{}; mapping set left unchanged",
                    editor.getSystem().wireName(), editor.getEntity().wireName());
            return AutoMapResult.noSuggestions();
        }

        editor.replaceAll(suggested);
        log.info("Applied {} suggested mappings to {}/{}", suggested.size(),
                editor.getSystem().wireName(), editor.getEntity().wireName());
        return AutoMapResult.suggested(suggested.size());
    }

    public AutoMapResult applyDefaults(MappingEditor editor) {
        Optional<MappingSet> defaults = schemaRegistry.getDefaultMappings(editor.getSystem(), editor.getEntity());
        if (defaults.isEmpty()) {
            log.info("No default mappings for {}/{}; mapping set left unchanged",
                    editor.getSystem().wireName(), editor.getEntity().wireName());
            return AutoMapResult.noDefaults();
        }
        List<FieldMapping> entries = defaults.get().entries().stream()
                .map(entry -> entry.withProvenance(Provenance.DEFAULT))
                .toList();
        editor.replaceAll(entries);
        return AutoMapResult.defaultsApplied(entries.size());
    }

    private List<FieldMapping> requestSuggestions(MappingEditor editor)
            throws ExecutionException, InterruptedException, TimeoutException {
        CompletableFuture<List<FieldMapping>> future = CompletableFuture.supplyAsync(
                () -> suggestionCapability.suggest(editor.getSystem(), editor.getEntity(),
                        editor.getSourceSchema(), editor.getCanonicalSchema()),
                suggestionExecutor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }
}
