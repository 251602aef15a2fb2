package io.etl4j.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etl4j.FormatConverter;
import io.etl4j.core.Dataset;
import io.etl4j.core.FormattedOutput;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Pretty-printed JSON object of API name to record array.
 */
public class JsonFormatConverter implements FormatConverter {

    private final ObjectMapper objectMapper;

    public JsonFormatConverter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public FormattedOutput convert(Dataset data, Path outputDir) throws IOException {
        byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(data.recordsByApi());
        return OutputFiles.write(outputDir, format(), json);
    }
}
