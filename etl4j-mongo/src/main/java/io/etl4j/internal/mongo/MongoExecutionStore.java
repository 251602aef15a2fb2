package io.etl4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.etl4j.core.JobExecution;
import io.etl4j.core.JobStatus;
import io.etl4j.store.ExecutionStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for job executions. Updates only match non-terminal documents.
 */
public class MongoExecutionStore implements ExecutionStore {

    private static final List<JobStatus> TERMINAL = List.of(JobStatus.COMPLETED, JobStatus.FAILED);

    private final MongoTemplate mongoTemplate;

    public MongoExecutionStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public JobExecution create(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        JobExecutionDocument doc = new JobExecutionDocument();
        doc.setId(execution.id());
        doc.setScheduleId(execution.scheduleId());
        doc.setStatus(execution.status());
        doc.setStartedAt(execution.startedAt());
        doc.setCompletedAt(execution.completedAt());
        doc.setMessage(execution.message());
        doc.setErrorDetails(execution.errorDetails());
        mongoTemplate.insert(doc);
        return toExecution(doc);
    }

    @Override
    public void updateStatus(String executionId, JobStatus status, String message) {
        Objects.requireNonNull(status, "status must not be null");
        Update u = new Update()
                .set("status", status)
                .set("message", message);
        updateOpen(executionId, u);
    }

    @Override
    public void complete(String executionId, JobStatus terminalStatus, String message,
                         Map<String, Object> errorDetails, Instant completedAt) {
        Objects.requireNonNull(terminalStatus, "terminalStatus must not be null");
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("status is not terminal: " + terminalStatus);
        }
        Update u = new Update()
                .set("status", terminalStatus)
                .set("message", message)
                .set("completedAt", completedAt);
        if (errorDetails != null && !errorDetails.isEmpty()) {
            u.set("errorDetails", errorDetails);
        }
        updateOpen(executionId, u);
    }

    @Override
    public Optional<JobExecution> findById(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(executionId, JobExecutionDocument.class))
                .map(MongoExecutionStore::toExecution);
    }

    @Override
    public List<JobExecution> findBySchedule(String scheduleId, int limit) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(Criteria.where("scheduleId").is(scheduleId));
        q.with(Sort.by(Sort.Order.desc("startedAt")));
        q.limit(limit);
        return mongoTemplate.find(q, JobExecutionDocument.class).stream().map(MongoExecutionStore::toExecution).toList();
    }

    private void updateOpen(String executionId, Update u) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Query q = new Query(
                Criteria.where("_id").is(executionId)
                        .and("status").nin(TERMINAL)
        );
        UpdateResult r = mongoTemplate.updateFirst(q, u, JobExecutionDocument.class);
        if (r.getMatchedCount() == 0) {
            throw new IllegalStateException("execution " + executionId + " is missing or already finished");
        }
    }

    private static JobExecution toExecution(JobExecutionDocument doc) {
        return new JobExecution(
                doc.getId(),
                doc.getScheduleId(),
                doc.getStatus(),
                doc.getStartedAt(),
                doc.getCompletedAt(),
                doc.getMessage(),
                doc.getErrorDetails()
        );
    }
}
