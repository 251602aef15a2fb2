package io.etl4j.testing;

import io.etl4j.core.ErrorLogEntry;
import io.etl4j.core.ErrorStats;
import io.etl4j.store.ErrorLogStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class InMemoryErrorLogStore implements ErrorLogStore {

    private final List<ErrorLogEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(ErrorLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public synchronized List<ErrorStats> statsSince(Instant since) {
        Map<List<String>, ErrorStats> grouped = new LinkedHashMap<>();
        for (ErrorLogEntry e : entries) {
            if (!e.recordedAt().isAfter(since)) {
                continue;
            }
            List<String> key = Arrays.asList(e.errorType(), e.errorCode());
            ErrorStats prev = grouped.get(key);
            grouped.put(key, prev == null
                    ? new ErrorStats(e.errorType(), e.errorCode(), 1, e.recordedAt(), e.recordedAt())
                    : new ErrorStats(e.errorType(), e.errorCode(), prev.count() + 1,
                            min(prev.firstOccurrence(), e.recordedAt()), max(prev.lastOccurrence(), e.recordedAt())));
        }
        return grouped.values().stream()
                .sorted(Comparator.comparingLong(ErrorStats::count).reversed())
                .toList();
    }

    public synchronized List<ErrorLogEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized List<ErrorLogEntry> withCode(String code) {
        return entries.stream().filter(e -> Objects.equals(code, e.errorCode())).toList();
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
