package io.etl4j.testing;

import io.etl4j.core.JobExecution;
import io.etl4j.core.JobStatus;
import io.etl4j.store.ExecutionStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps every status change so tests can assert the exact sequence a run went through.
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private final Map<String, JobExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, List<JobStatus>> history = new ConcurrentHashMap<>();
    private final Map<String, List<String>> messages = new ConcurrentHashMap<>();

    @Override
    public JobExecution create(JobExecution execution) {
        String id = UUID.randomUUID().toString();
        JobExecution stored = new JobExecution(id, execution.scheduleId(), execution.status(), execution.startedAt(),
                null, execution.message(), execution.errorDetails());
        executions.put(id, stored);
        history.put(id, new ArrayList<>(List.of(execution.status())));
        messages.put(id, new ArrayList<>(List.of(execution.message())));
        return stored;
    }

    @Override
    public synchronized void updateStatus(String executionId, JobStatus status, String message) {
        JobExecution e = requireOpen(executionId);
        executions.put(executionId, new JobExecution(e.id(), e.scheduleId(), status, e.startedAt(), null, message, e.errorDetails()));
        history.get(executionId).add(status);
        messages.get(executionId).add(message);
    }

    @Override
    public synchronized void complete(String executionId, JobStatus terminalStatus, String message,
                                      Map<String, Object> errorDetails, Instant completedAt) {
        JobExecution e = requireOpen(executionId);
        executions.put(executionId, new JobExecution(e.id(), e.scheduleId(), terminalStatus, e.startedAt(), completedAt, message, errorDetails));
        history.get(executionId).add(terminalStatus);
        messages.get(executionId).add(message);
    }

    @Override
    public Optional<JobExecution> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<JobExecution> findBySchedule(String scheduleId, int limit) {
        return executions.values().stream()
                .filter(e -> e.scheduleId().equals(scheduleId))
                .sorted(Comparator.comparing(JobExecution::startedAt).reversed())
                .limit(limit)
                .toList();
    }

    public List<JobStatus> history(String executionId) {
        return history.get(executionId);
    }

    public List<String> messages(String executionId) {
        return messages.get(executionId);
    }

    private JobExecution requireOpen(String executionId) {
        JobExecution e = executions.get(executionId);
        if (e == null) {
            throw new IllegalStateException("unknown execution " + executionId);
        }
        if (e.status().isTerminal()) {
            throw new IllegalStateException("execution " + executionId + " is already " + e.status());
        }
        return e;
    }
}
