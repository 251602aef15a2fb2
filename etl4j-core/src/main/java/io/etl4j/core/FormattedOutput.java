package io.etl4j.core;

import java.nio.file.Path;

public record FormattedOutput(Path path, String format, long size) {
}
