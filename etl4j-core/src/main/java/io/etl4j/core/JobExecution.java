package io.etl4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * One run of a {@link Schedule}. Immutable once {@link JobStatus#isTerminal() terminal}.
 */
public record JobExecution(
        String id,
        String scheduleId,
        JobStatus status,
        Instant startedAt,
        Instant completedAt,
        String message,
        Map<String, Object> errorDetails
) {
    public JobExecution {
        errorDetails = errorDetails == null ? Map.of() : Map.copyOf(errorDetails);
    }

    public static JobExecution pending(String scheduleId, Instant startedAt) {
        return new JobExecution(null, scheduleId, JobStatus.PENDING, startedAt, null, "Job queued", Map.of());
    }
}
