package io.etl4j.store;

import io.etl4j.core.JobExecution;
import io.etl4j.core.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence of {@link JobExecution}s. Implementations refuse to change a terminal execution
 * and throw {@link IllegalStateException} when asked to.
 */
public interface ExecutionStore {

    JobExecution create(JobExecution execution);

    void updateStatus(String executionId, JobStatus status, String message);

    void complete(String executionId, JobStatus terminalStatus, String message, Map<String, Object> errorDetails, Instant completedAt);

    Optional<JobExecution> findById(String executionId);

    /**
     * Newest first.
     */
    List<JobExecution> findBySchedule(String scheduleId, int limit);
}
