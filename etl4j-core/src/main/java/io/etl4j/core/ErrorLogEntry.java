package io.etl4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One recorded failure of an OAuth operation or a job run.
 *
 * <p>{@code context} names where it happened ({@code operation}, {@code scheduleId},
 * {@code destinationId}, ...). Neither map ever holds decrypted credentials.
 */
public record ErrorLogEntry(
        String errorType,
        String errorCode,
        String message,
        Map<String, Object> details,
        Map<String, String> context,
        Instant recordedAt
) {
    public ErrorLogEntry {
        Objects.requireNonNull(errorType, "errorType must not be null");
        Objects.requireNonNull(recordedAt, "recordedAt must not be null");
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
