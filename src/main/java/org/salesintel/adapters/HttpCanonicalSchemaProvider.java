package org.salesintel.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.salesintel.exception.SchemaProviderException;
import org.salesintel.models.dto.CanonicalFieldDefinition;
import org.salesintel.models.dto.CanonicalFieldSchema;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.FieldDataType;
import org.salesintel.models.enums.SourceSystem;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class HttpCanonicalSchemaProvider implements CanonicalSchemaProvider {

    private final RestClient restClient;
    private final boolean enabled;

    public HttpCanonicalSchemaProvider(RestClient.Builder restClientBuilder,
                                       @Value("${mapping.service.base-url:}") String baseUrl) {
        this.enabled = StringUtils.hasText(baseUrl);
        this.restClient = enabled ? restClientBuilder.baseUrl(baseUrl).build() : null;
    }

    @Override
    public CanonicalFieldSchema fetch(EntityType entity, SourceSystem system) {
        if (!enabled) {
            throw new SchemaProviderException("Mapping service is not configured");
        }
        JsonNode body;
        try {
            body = restClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/ai-mapping/canonical-schema/{entity}")
                            .queryParam("integration", system.wireName())
                            .build(entity.wireName()))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new SchemaProviderException("Canonical schema request failed for " + entity.wireName()
                    + ": " + e.getMessage(), e);
        }

        JsonNode fieldsNode = body == null ? null : body.get("fields");
        if (fieldsNode == null) {
            throw new SchemaProviderException("Malformed canonical schema payload for " + entity.wireName());
        }

        List<CanonicalFieldDefinition> fields = new ArrayList<>();
        if (fieldsNode.isArray()) {
            for (JsonNode field : fieldsNode) {
                String name = field.path("name").asText(null);
                if (!StringUtils.hasText(name)) {
                    throw new SchemaProviderException("Canonical field without a name for " + entity.wireName());
                }
                fields.add(toDefinition(name, field));
            }
        } else if (fieldsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> iterator = fieldsNode.fields();
            while (iterator.hasNext()) {
                Map.Entry<String, JsonNode> entry = iterator.next();
                fields.add(toDefinition(entry.getKey(), entry.getValue()));
            }
        } else {
            throw new SchemaProviderException("Malformed canonical schema payload for " + entity.wireName());
        }

        log.debug("Fetched {} live canonical fields for {}", fields.size(), entity.wireName());
        return new CanonicalFieldSchema(entity, fields);
    }

    @Override
    public boolean supports(EntityType entity, SourceSystem system) {
        return enabled;
    }

    private CanonicalFieldDefinition toDefinition(String name, JsonNode field) {
        return new CanonicalFieldDefinition(
                name,
                FieldDataType.fromWireName(field.path("type").asText(null)),
                field.path("required").asBoolean(false),
                field.path("description").asText(name)
        );
    }
}
