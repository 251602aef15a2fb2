package io.etl4j.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etl4j.core.Dataset;
import io.etl4j.core.FormatConverterRegistry;
import io.etl4j.core.FormattedOutput;
import io.etl4j.error.FormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormatConvertersTest {

    @TempDir
    Path dir;

    private final FormatConverterRegistry registry = new FormatConverterRegistry(List.of(
            new JsonFormatConverter(new ObjectMapper()), new CsvFormatConverter(), new XmlFormatConverter()));

    @Test
    void csvShouldFlattenNestedValuesAndQuote() throws Exception {
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("id", 1);
        order.put("note", "fragile, \"handle\" with care");
        order.put("address", Map.of("city", "Taipei"));
        order.put("tags", List.of("a", "b"));
        Dataset data = new Dataset(Map.of("orders", List.of(order, Map.of("id", 2, "extra", "x"))));

        FormattedOutput out = registry.getRequired("CSV").convert(data, dir);

        List<String> lines = Files.readAllLines(out.path(), StandardCharsets.UTF_8);
        assertEquals("_api,id,note,address_city,tags,extra", lines.get(0));
        assertEquals("orders,1,\"fragile, \"\"handle\"\" with care\",Taipei,\"a, b\",", lines.get(1));
        assertEquals("orders,2,,,,x", lines.get(2));
        assertEquals("csv", out.format());
        assertEquals(Files.size(out.path()), out.size());
    }

    @Test
    void csvShouldKeepApiNameWhenRecordHasApiField() throws Exception {
        Dataset data = new Dataset(Map.of("orders", List.of(Map.of("id", 1, "api", "rest"))));

        FormattedOutput out = registry.getRequired("csv").convert(data, dir);

        List<String> lines = Files.readAllLines(out.path(), StandardCharsets.UTF_8);
        List<String> header = List.of(lines.get(0).split(","));
        List<String> values = List.of(lines.get(1).split(","));
        assertEquals("orders", values.get(header.indexOf("_api")));
        assertEquals("rest", values.get(header.indexOf("api")));
    }

    @Test
    void csvShouldRejectRecordFieldNamedLikeApiColumn() {
        Dataset data = new Dataset(Map.of("orders", List.of(Map.of("id", 1, "_api", "shadow"))));

        FormatException e = assertThrows(FormatException.class, () -> registry.getRequired("csv").convert(data, dir));

        assertEquals("orders", e.details().get("api"));
    }

    @Test
    void jsonShouldBePrettyPrintedAndRandomlyNamed() throws Exception {
        Dataset data = new Dataset(Map.of("orders", List.of(Map.of("id", 1))));

        FormattedOutput a = registry.getRequired("json").convert(data, dir);
        FormattedOutput b = registry.getRequired("json").convert(data, dir);

        String json = Files.readString(a.path());
        assertTrue(json.contains("\n"));
        assertEquals(Map.of("orders", List.of(Map.of("id", 1))), new ObjectMapper().readValue(json, Map.class));
        assertNotEquals(a.path(), b.path());
        assertTrue(a.path().getFileName().toString().matches("[0-9a-f]{32}\\.json"));
    }

    @Test
    void xmlShouldUseDataRoot() throws Exception {
        Dataset data = new Dataset(Map.of("orders", List.of(Map.of("id", 1))));

        FormattedOutput out = registry.getRequired("xml").convert(data, dir);

        String xml = Files.readString(out.path());
        assertTrue(xml.trim().startsWith("<data>"));
        assertTrue(xml.contains("<id>1</id>"));
    }

    @Test
    void unknownFormatShouldFail() {
        assertThrows(FormatException.class, () -> registry.getRequired("parquet"));
    }

    @Test
    void duplicateFormatShouldBeRejected() {
        assertThrows(IllegalStateException.class, () -> new FormatConverterRegistry(List.of(
                new CsvFormatConverter(), new CsvFormatConverter())));
    }
}
