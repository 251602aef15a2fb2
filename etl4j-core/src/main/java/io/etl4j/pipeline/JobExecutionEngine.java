package io.etl4j.pipeline;

import io.etl4j.core.Dataset;
import io.etl4j.core.Destination;
import io.etl4j.core.FormattedOutput;
import io.etl4j.core.JobExecution;
import io.etl4j.core.JobStatus;
import io.etl4j.core.Schedule;
import io.etl4j.error.DestinationException;
import io.etl4j.error.ErrorLogger;
import io.etl4j.error.EtlException;
import io.etl4j.error.ValidationException;
import io.etl4j.store.ExecutionStore;
import io.etl4j.store.ScheduleStore;
import io.etl4j.store.TokenStore;
import io.etl4j.utils.NextRunCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Drives one run of a schedule through extract, validate, transform, format and upload.
 *
 * <p>Every status change is persisted before the stage body runs. A failed run ends as
 * {@link JobStatus#FAILED} with message {@code "Job failed: <cause>"} and the error is rethrown
 * so the scheduler can apply its failure policy. Failures are also recorded through the
 * {@link ErrorLogger}. On success the schedule's {@code lastRun} and
 * {@code nextRun} are updated from its current definition.
 */
public class JobExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(JobExecutionEngine.class);

    public static final String MDC_SCHEDULE_ID = "scheduleId";
    public static final String MDC_EXECUTION_ID = "executionId";

    private final ScheduleStore scheduleStore;
    private final ExecutionStore executionStore;
    private final TokenStore tokenStore;
    private final PipelineStages stages;
    private final ErrorLogger errorLogger;
    private final Clock clock;

    public JobExecutionEngine(ScheduleStore scheduleStore, ExecutionStore executionStore, TokenStore tokenStore,
                              PipelineStages stages, ErrorLogger errorLogger, Clock clock) {
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.executionStore = Objects.requireNonNull(executionStore, "executionStore must not be null");
        this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore must not be null");
        this.stages = Objects.requireNonNull(stages, "stages must not be null");
        this.errorLogger = Objects.requireNonNull(errorLogger, "errorLogger must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return the completed execution
     * @throws EtlException the stage failure, after the execution was stored as FAILED
     */
    public JobExecution run(Schedule schedule) {
        JobExecution execution = executionStore.create(JobExecution.pending(schedule.id(), clock.instant()));
        String executionId = execution.id();
        MDC.put(MDC_SCHEDULE_ID, schedule.id());
        MDC.put(MDC_EXECUTION_ID, executionId);
        try {
            log.info("etl4j run started scheduleId={} executionId={}", schedule.id(), executionId);
            try {
                runStages(schedule, executionId);
            } catch (Exception e) {
                throw fail(schedule.id(), executionId, e);
            }

            Instant finishedAt = clock.instant();
            executionStore.complete(executionId, JobStatus.COMPLETED, "Job completed successfully", Map.of(), finishedAt);

            Schedule current = scheduleStore.findById(schedule.id()).orElse(schedule);
            Instant nextRun = NextRunCalculator.nextRun(current, finishedAt);
            scheduleStore.recordSuccess(schedule.id(), finishedAt, nextRun);

            log.info("etl4j run completed scheduleId={} executionId={} nextRun={}", schedule.id(), executionId, nextRun);
            return executionStore.findById(executionId).orElse(execution);
        } finally {
            MDC.remove(MDC_SCHEDULE_ID);
            MDC.remove(MDC_EXECUTION_ID);
        }
    }

    private void runStages(Schedule schedule, String executionId) {
        transition(executionId, JobStatus.STARTED, "Job started");

        transition(executionId, JobStatus.EXTRACTING, "Extracting data from source " + schedule.sourceId());
        Dataset extracted = stages.extract(schedule.sourceId());

        transition(executionId, JobStatus.VALIDATING, "Validating " + extracted.recordCount() + " records");
        ValidationResult validation = stages.validate(extracted);
        if (!validation.isValid()) {
            throw new ValidationException(validation.violations());
        }

        transition(executionId, JobStatus.TRANSFORMING, schedule.transformationId() == null
                ? "No transformation configured"
                : "Applying transformation " + schedule.transformationId());
        Dataset transformed = stages.transform(schedule.transformationId(), extracted);

        Destination destination = tokenStore.findDestination(schedule.destinationId())
                .orElseThrow(() -> new DestinationException("Destination not found: " + schedule.destinationId(),
                        Map.of("destinationId", String.valueOf(schedule.destinationId())), null));

        transition(executionId, JobStatus.FORMATTING, "Converting data to " + destination.fileFormat());
        FormattedOutput output = stages.format(transformed, destination.fileFormat());

        transition(executionId, JobStatus.UPLOADING, "Uploading " + output.size() + " bytes to " + destination.type());
        stages.upload(output, destination, (attempt, max, delay, failure) -> {
            String message = "Upload attempt " + attempt + "/" + max + " failed: " + failure.getMessage()
                    + "; retrying in " + delay.toMillis() + "ms";
            log.warn("etl4j upload retry executionId={} attempt={}/{} msg={}", executionId, attempt, max, failure.getMessage());
            executionStore.updateStatus(executionId, JobStatus.UPLOADING, message);
        });
    }

    private void transition(String executionId, JobStatus status, String message) {
        executionStore.updateStatus(executionId, status, message);
        log.debug("etl4j run status executionId={} status={} msg={}", executionId, status, message);
    }

    private EtlException fail(String scheduleId, String executionId, Exception e) {
        EtlException error = e instanceof EtlException etl
                ? etl
                : new EtlException(String.valueOf(e.getMessage()), "INTERNAL_ERROR", Map.of(), false, e);
        String message = "Job failed: " + error.getMessage();
        log.error("etl4j run failed executionId={} code={} msg={}", executionId, error.code(), error.getMessage(), e);
        try {
            executionStore.complete(executionId, JobStatus.FAILED, message, error.toErrorDetails(), clock.instant());
        } catch (RuntimeException storeEx) {
            log.error("etl4j could not store failed execution executionId={} msg={}", executionId, storeEx.getMessage(), storeEx);
            error.addSuppressed(storeEx);
        }

        Map<String, String> context = new LinkedHashMap<>();
        context.put("operation", "jobRun");
        context.put(MDC_SCHEDULE_ID, scheduleId);
        context.put(MDC_EXECUTION_ID, executionId);
        errorLogger.logError(error, context);
        return error;
    }
}
