package org.salesintel.models.dto;

import java.util.List;
import java.util.Map;

public record MappingPreview(Map<String, Object> values, List<MappingWarning> warnings) {
}
