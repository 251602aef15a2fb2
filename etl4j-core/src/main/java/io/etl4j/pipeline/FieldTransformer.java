package io.etl4j.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etl4j.core.Dataset;
import io.etl4j.core.TransformationDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a transformation's operations in order to copies of the records.
 */
public class FieldTransformer {

    private final ObjectMapper objectMapper;

    public FieldTransformer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public Dataset apply(TransformationDefinition definition, Dataset input) {
        // parse everything first so a bad operation fails before any record is touched
        List<FieldOperation> operations = definition.operations().stream()
                .map(FieldOperation::parse)
                .toList();

        Map<String, List<Map<String, Object>>> out = new LinkedHashMap<>();
        input.recordsByApi().forEach((api, records) -> {
            List<Map<String, Object>> transformed = new ArrayList<>(records.size());
            for (Map<String, Object> record : records) {
                Map<String, Object> copy = new LinkedHashMap<>(record);
                for (FieldOperation op : operations) {
                    if (op.appliesTo(api)) {
                        op.apply(copy, objectMapper);
                    }
                }
                transformed.add(copy);
            }
            out.put(api, transformed);
        });
        return new Dataset(out);
    }
}
