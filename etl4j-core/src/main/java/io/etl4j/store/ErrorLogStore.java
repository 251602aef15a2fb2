package io.etl4j.store;

import io.etl4j.core.ErrorLogEntry;
import io.etl4j.core.ErrorStats;

import java.time.Instant;
import java.util.List;

/**
 * Append-only log of OAuth and job failures.
 */
public interface ErrorLogStore {

    void append(ErrorLogEntry entry);

    /**
     * Entries recorded after {@code since}, grouped by error type and code, most frequent first.
     */
    List<ErrorStats> statsSince(Instant since);
}
