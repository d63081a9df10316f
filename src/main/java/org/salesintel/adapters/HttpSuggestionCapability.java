package org.salesintel.adapters;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.salesintel.exception.SuggestionUnavailableException;
import org.salesintel.models.dto.CanonicalFieldSchema;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.SourceFieldSchema;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.Provenance;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.models.enums.TransformType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the mapping service's LLM endpoint for candidate mappings. Candidates without a target
 * field are dropped, as the service reports "no good match" that way.
 */
@Slf4j
@Component
public class HttpSuggestionCapability implements SuggestionCapability {

    private static final double DEFAULT_CONFIDENCE = 0.8;

    private final RestClient restClient;
    private final boolean enabled;

    public HttpSuggestionCapability(RestClient.Builder restClientBuilder,
                                    @Value("${mapping.service.base-url:}") String baseUrl) {
        this.enabled = StringUtils.hasText(baseUrl);
        this.restClient = enabled ? restClientBuilder.baseUrl(baseUrl).build() : null;
        if (!enabled) {
            log.info("Mapping service URL not configured; auto-map will fall back to default mappings");
        }
    }

    @Override
    public List<FieldMapping> suggest(SourceSystem system,
                                      EntityType entity,
                                      SourceFieldSchema sourceSchema,
                                      CanonicalFieldSchema canonicalSchema) {
        if (!enabled) {
            throw new SuggestionUnavailableException("Mapping suggestion service is not configured");
        }

        SuggestionRequest request = new SuggestionRequest(
                system.displayName(),
                entity.wireName(),
                sourceSchema.fields().stream()
                        .map(field -> new SourceFieldPayload(field.name(), field.type().wireName(), field.label()))
                        .toList(),
                canonicalSchema.fields().stream()
                        .map(field -> new TargetFieldPayload(field.name(), field.type().wireName(), field.required(), field.description()))
                        .toList()
        );

        JsonNode body;
        try {
            body = restClient.post()
                    .uri("/ai-mapping/suggest")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new SuggestionUnavailableException("Mapping suggestion request failed: " + e.getMessage(), e);
        }

        JsonNode suggestions = body == null ? null : body.get("suggestions");
        if (suggestions == null || !suggestions.isArray()) {
            throw new SuggestionUnavailableException("Malformed suggestion payload for " + system.wireName() + "/" + entity.wireName());
        }

        List<FieldMapping> candidates = new ArrayList<>();
        for (JsonNode suggestion : suggestions) {
            String sourceField = suggestion.path("source_field").asText(null);
            String targetField = suggestion.path("target_field").asText(null);
            if (!StringUtils.hasText(sourceField) || !StringUtils.hasText(targetField)) {
                continue;
            }
            double confidence = clamp(suggestion.path("confidence").asDouble(DEFAULT_CONFIDENCE));
            candidates.add(FieldMapping.of(sourceField, targetField, readTransform(suggestion),
                    confidence, Provenance.AI_SUGGESTED));
        }
        log.debug("Mapping service returned {} candidates for {}/{}", candidates.size(), system.wireName(), entity.wireName());
        return candidates;
    }

    private TransformType readTransform(JsonNode suggestion) {
        String transform = suggestion.path("transform").asText(null);
        try {
            return TransformType.fromWireName(transform);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unsupported suggested transform '{}'", transform);
            return TransformType.NONE;
        }
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    record SuggestionRequest(
            @JsonProperty("source_name") String sourceName,
            @JsonProperty("entity_type") String entityType,
            @JsonProperty("source_fields") List<SourceFieldPayload> sourceFields,
            @JsonProperty("target_fields") List<TargetFieldPayload> targetFields
    ) {
    }

    record SourceFieldPayload(String name, String type, String description) {
    }

    record TargetFieldPayload(String name, String type, boolean required, String description) {
    }
}
