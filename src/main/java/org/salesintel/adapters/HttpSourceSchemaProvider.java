package org.salesintel.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.salesintel.exception.SchemaProviderException;
import org.salesintel.models.dto.SourceFieldDefinition;
import org.salesintel.models.dto.SourceFieldSchema;
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

/**
 * Reads live field definitions from the connector gateway, which answers in the Odoo
 * {@code fields_get} shape: {@code {"fields": {"name": {"string": "Company Name", "type": "char"}}}}.
 */
@Slf4j
@Component
public class HttpSourceSchemaProvider implements SourceSchemaProvider {

    private final RestClient restClient;
    private final boolean enabled;

    public HttpSourceSchemaProvider(RestClient.Builder restClientBuilder,
                                    @Value("${mapping.connector.base-url:}") String baseUrl) {
        this.enabled = StringUtils.hasText(baseUrl);
        this.restClient = enabled ? restClientBuilder.baseUrl(baseUrl).build() : null;
        if (!enabled) {
            log.info("Connector gateway URL not configured; source schemas will use built-in defaults");
        }
    }

    @Override
    public SourceFieldSchema fetch(SourceSystem system, EntityType entity) {
        if (!enabled) {
            throw new SchemaProviderException("Connector gateway is not configured");
        }
        JsonNode body;
        try {
            body = restClient.get()
                    .uri("/api/connectors/{system}/schema/{entity}", system.wireName(), entity.wireName())
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new SchemaProviderException("Connector gateway request failed for " + system.wireName()
                    + "/" + entity.wireName() + ": " + e.getMessage(), e);
        }

        JsonNode fieldsNode = body == null ? null : body.get("fields");
        if (fieldsNode == null || !fieldsNode.isObject()) {
            throw new SchemaProviderException("Malformed schema payload for " + system.wireName() + "/" + entity.wireName());
        }

        List<SourceFieldDefinition> fields = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = fieldsNode.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            JsonNode definition = entry.getValue();
            String label = definition.hasNonNull("string")
                    ? definition.get("string").asText()
                    : definition.path("label").asText(entry.getKey());
            FieldDataType type = FieldDataType.fromWireName(definition.path("type").asText(null));
            fields.add(new SourceFieldDefinition(entry.getKey(), label, type));
        }

        log.debug("Fetched {} live source fields for {}/{}", fields.size(), system.wireName(), entity.wireName());
        return new SourceFieldSchema(system, entity, fields);
    }

    @Override
    public boolean supports(SourceSystem system, EntityType entity) {
        return enabled && system.supports(entity);
    }
}
