package io.etl4j.format;

import io.etl4j.core.FormattedOutput;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.HexFormat;

final class OutputFiles {

    private static final SecureRandom RANDOM = new SecureRandom();

    private OutputFiles() {
    }

    /**
     * Write {@code content} to a new file with a random 32-hex-char name.
     */
    static FormattedOutput write(Path dir, String format, byte[] content) throws IOException {
        byte[] name = new byte[16];
        RANDOM.nextBytes(name);
        Path path = dir.resolve(HexFormat.of().formatHex(name) + "." + format);
        Files.write(path, content);
        return new FormattedOutput(path, format, content.length);
    }
}
