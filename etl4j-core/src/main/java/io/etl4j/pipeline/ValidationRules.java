package io.etl4j.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative record rules: fields that must be present and non-null, and the expected type of
 * fields when present.
 */
public record ValidationRules(List<String> requiredFields, Map<String, FieldType> fieldTypes) {
    public ValidationRules {
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        fieldTypes = fieldTypes == null ? Map.of() : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(fieldTypes));
    }

    public static ValidationRules defaults() {
        Map<String, FieldType> types = new LinkedHashMap<>();
        types.put("id", FieldType.NUMBER);
        types.put("created_at", FieldType.STRING);
        types.put("updated_at", FieldType.STRING);
        return new ValidationRules(List.of("id", "created_at"), types);
    }
}
