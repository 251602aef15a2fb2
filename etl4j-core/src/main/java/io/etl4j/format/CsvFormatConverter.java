package io.etl4j.format;

import com.opencsv.CSVWriter;
import io.etl4j.FormatConverter;
import io.etl4j.core.Dataset;
import io.etl4j.core.FormattedOutput;
import io.etl4j.error.FormatException;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One CSV row per record, first column {@value #API_COLUMN} holding the API name.
 *
 * <p>Nested objects are flattened with {@code _} ({@code address.city} becomes {@code address_city}),
 * arrays are joined with {@code ", "}. The header is the union of all columns in first-seen order.
 * A record column that flattens to {@value #API_COLUMN} is rejected.
 */
public class CsvFormatConverter implements FormatConverter {

    static final String API_COLUMN = "_api";

    @Override
    public String format() {
        return "csv";
    }

    @Override
    public FormattedOutput convert(Dataset data, Path outputDir) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        Set<String> header = new LinkedHashSet<>();
        header.add(API_COLUMN);
        data.recordsByApi().forEach((api, records) -> {
            for (int i = 0; i < records.size(); i++) {
                Map<String, Object> row = new LinkedHashMap<>();
                flatten("", records.get(i), row);
                if (row.containsKey(API_COLUMN)) {
                    throw new FormatException("Record field collides with the reserved CSV column " + API_COLUMN,
                            Map.of("api", api, "recordIndex", i));
                }
                header.addAll(row.keySet());
                row.put(API_COLUMN, api);
                rows.add(row);
            }
        });

        String[] columns = header.toArray(String[]::new);
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out, CSVWriter.DEFAULT_SEPARATOR, CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_QUOTE_CHARACTER, "\r\n")) {
            writer.writeNext(columns, false);
            for (Map<String, Object> row : rows) {
                String[] line = new String[columns.length];
                for (int c = 0; c < columns.length; c++) {
                    Object value = row.get(columns[c]);
                    line[c] = value == null ? "" : String.valueOf(value);
                }
                writer.writeNext(line, false);
            }
        }
        return OutputFiles.write(outputDir, format(), out.toString().getBytes(StandardCharsets.UTF_8));
    }

    static void flatten(String prefix, Map<?, ?> source, Map<String, Object> out) {
        source.forEach((k, v) -> {
            String key = prefix.isEmpty() ? String.valueOf(k) : prefix + "_" + k;
            if (v instanceof Map<?, ?> nested) {
                flatten(key, nested, out);
            } else if (v instanceof Collection<?> list) {
                out.put(key, list.stream().map(String::valueOf).collect(Collectors.joining(", ")));
            } else {
                out.put(key, v);
            }
        });
    }
}
