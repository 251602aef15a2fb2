package io.etl4j.error;

import io.etl4j.core.ErrorLogEntry;
import io.etl4j.core.ErrorStats;
import io.etl4j.store.ErrorLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Records OAuth and job failures in an {@link ErrorLogStore} and reports grouped statistics.
 *
 * <p>{@link #logError(Throwable, Map)} never throws: when the store is down the failure is only
 * written to the application log.
 */
public class ErrorLogger {
    private static final Logger log = LoggerFactory.getLogger(ErrorLogger.class);

    private static final int MAX_CAUSES = 10;

    private final ErrorLogStore store;
    private final Clock clock;

    public ErrorLogger(ErrorLogStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void logError(Throwable error, Map<String, String> context) {
        Objects.requireNonNull(error, "error must not be null");
        String code = error instanceof EtlException etl ? etl.code() : null;
        ErrorLogEntry entry = new ErrorLogEntry(error.getClass().getSimpleName(), code, error.getMessage(),
                detailsOf(error), context, clock.instant());
        try {
            store.append(entry);
        } catch (RuntimeException e) {
            log.error("etl4j error log write failed errorType={} errorCode={} context={} msg={}",
                    entry.errorType(), code, entry.context(), e.getMessage(), e);
        }
    }

    /**
     * Failures of the last {@code timeframe}, grouped by type and code, most frequent first.
     */
    public List<ErrorStats> getErrorStats(Duration timeframe) {
        Objects.requireNonNull(timeframe, "timeframe must not be null");
        if (timeframe.isNegative()) {
            throw new IllegalArgumentException("timeframe must not be negative");
        }
        return store.statsSince(clock.instant().minus(timeframe));
    }

    static Map<String, Object> detailsOf(Throwable error) {
        if (error instanceof EtlException etl) {
            return etl.toErrorDetails();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", error.getClass().getSimpleName());
        out.put("message", String.valueOf(error.getMessage()));
        List<String> causes = new ArrayList<>();
        Throwable c = error.getCause();
        while (c != null && causes.size() < MAX_CAUSES) {
            causes.add(c.getClass().getName() + ": " + c.getMessage());
            c = c.getCause();
        }
        if (!causes.isEmpty()) {
            out.put("causes", causes);
        }
        return out;
    }
}
