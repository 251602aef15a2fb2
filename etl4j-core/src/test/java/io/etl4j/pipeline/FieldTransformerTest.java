package io.etl4j.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etl4j.core.Dataset;
import io.etl4j.core.TransformationDefinition;
import io.etl4j.error.TransformationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FieldTransformerTest {

    private final FieldTransformer transformer = new FieldTransformer(new ObjectMapper());

    @Test
    void operationsShouldApplyInOrder() {
        TransformationDefinition def = new TransformationDefinition("t1", "src", List.of(
                Map.of("type", "CAST", "api", "orders", "field", "total", "configuration", Map.of("targetType", "NUMBER")),
                Map.of("type", "CONCATENATE", "field", "customer", "configuration",
                        Map.of("fields", List.of("first_name", "last_name"), "separator", " ")),
                Map.of("type", "STRINGIFY", "field", "tags")));
        Dataset input = new Dataset(Map.of("orders", List.of(Map.of(
                "total", "12.50", "first_name", "Ada", "last_name", "Lovelace", "tags", List.of("a", "b")))));

        Dataset out = transformer.apply(def, input);

        Map<String, Object> record = out.records("orders").get(0);
        assertEquals(12.5, record.get("total"));
        assertEquals("Ada Lovelace", record.get("customer"));
        assertEquals("[\"a\",\"b\"]", record.get("tags"));
        assertEquals("12.50", input.records("orders").get(0).get("total"));
    }

    @Test
    void castShouldProduceIntegersAndBooleans() {
        TransformationDefinition def = new TransformationDefinition("t1", "src", List.of(
                Map.of("type", "cast", "field", "qty", "configuration", Map.of("targetType", "number")),
                Map.of("type", "CAST", "field", "paid", "configuration", Map.of("targetType", "BOOLEAN")),
                Map.of("type", "CAST", "field", "id", "configuration", Map.of("targetType", "STRING"))));
        Dataset input = new Dataset(Map.of("orders", List.of(Map.of("qty", "3", "paid", "true", "id", 42))));

        Map<String, Object> record = transformer.apply(def, input).records("orders").get(0);

        assertEquals(3L, record.get("qty"));
        assertEquals(true, record.get("paid"));
        assertEquals("42", record.get("id"));
    }

    @Test
    void operationScopedToApiShouldLeaveOthersAlone() {
        TransformationDefinition def = new TransformationDefinition("t1", "src", List.of(
                Map.of("type", "STRINGIFY", "api", "customers", "field", "address")));
        Dataset input = new Dataset(Map.of(
                "orders", List.of(Map.of("address", Map.of("city", "Taipei"))),
                "customers", List.of(Map.of("address", Map.of("city", "Oslo")))));

        Dataset out = transformer.apply(def, input);

        assertEquals(Map.of("city", "Taipei"), out.records("orders").get(0).get("address"));
        assertEquals("{\"city\":\"Oslo\"}", out.records("customers").get(0).get("address"));
    }

    @Test
    void unknownOperationShouldFail() {
        TransformationDefinition def = new TransformationDefinition("t1", "src", List.of(
                Map.of("type", "UPPERCASE", "field", "name")));

        TransformationException e = assertThrows(TransformationException.class,
                () -> transformer.apply(def, new Dataset(Map.of("orders", List.of(Map.of("name", "x"))))));
        assertEquals("Unknown transformation type: UPPERCASE", e.getMessage());
    }

    @Test
    void impossibleCastShouldFail() {
        TransformationDefinition def = new TransformationDefinition("t1", "src", List.of(
                Map.of("type", "CAST", "field", "total", "configuration", Map.of("targetType", "NUMBER"))));

        assertThrows(TransformationException.class,
                () -> transformer.apply(def, new Dataset(Map.of("orders", List.of(Map.of("total", "twelve"))))));
    }
}
