package io.etl4j.format;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.etl4j.FormatConverter;
import io.etl4j.core.Dataset;
import io.etl4j.core.FormattedOutput;

import java.io.IOException;
import java.nio.file.Path;

/**
 * XML document with root element {@code data} and one element per record under its API name.
 */
public class XmlFormatConverter implements FormatConverter {

    private final XmlMapper xmlMapper;

    public XmlFormatConverter() {
        this(new XmlMapper());
    }

    public XmlFormatConverter(XmlMapper xmlMapper) {
        this.xmlMapper = xmlMapper;
    }

    @Override
    public String format() {
        return "xml";
    }

    @Override
    public FormattedOutput convert(Dataset data, Path outputDir) throws IOException {
        byte[] xml = xmlMapper.writer()
                .withRootName("data")
                .withDefaultPrettyPrinter()
                .writeValueAsBytes(data.recordsByApi());
        return OutputFiles.write(outputDir, format(), xml);
    }
}
