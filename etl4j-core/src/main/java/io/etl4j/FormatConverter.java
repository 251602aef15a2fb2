package io.etl4j;

import io.etl4j.core.Dataset;
import io.etl4j.core.FormattedOutput;

import java.nio.file.Path;

/**
 * Serializes a dataset into a file. One implementation per format name ({@code csv}, {@code json}, ...).
 */
public interface FormatConverter {

    String format();

    FormattedOutput convert(Dataset data, Path outputDir) throws Exception;
}
