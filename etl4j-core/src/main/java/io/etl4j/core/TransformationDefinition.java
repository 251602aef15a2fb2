package io.etl4j.core;

import java.util.List;
import java.util.Map;

/**
 * Ordered field operations, each a raw config map with at least a {@code type} key.
 */
public record TransformationDefinition(String id, String sourceId, List<Map<String, Object>> operations) {
    public TransformationDefinition {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
