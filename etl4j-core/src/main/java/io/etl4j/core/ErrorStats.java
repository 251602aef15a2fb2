package io.etl4j.core;

import java.time.Instant;

/**
 * Failures of one type and code within a timeframe.
 */
public record ErrorStats(
        String errorType,
        String errorCode,
        long count,
        Instant firstOccurrence,
        Instant lastOccurrence
) {
}
