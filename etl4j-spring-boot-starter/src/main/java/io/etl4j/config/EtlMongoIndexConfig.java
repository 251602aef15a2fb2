package io.etl4j.config;

import io.etl4j.internal.mongo.CredentialAuditDocument;
import io.etl4j.internal.mongo.ErrorLogDocument;
import io.etl4j.internal.mongo.JobExecutionDocument;
import io.etl4j.internal.mongo.OAuthStateDocument;
import io.etl4j.internal.mongo.ScheduleDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.time.Duration;
import java.util.Objects;

/**
 * MongoDB index definitions for etl4j.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code etl4j.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_due_claim</b> on {@code etl_schedules}: { active: 1, nextRun: 1, lockUntil: 1 }
 *       <br/>Used by the poller's claim query.</li>
 *   <li><b>idx_schedule_started</b> on {@code etl_job_executions}: { scheduleId: 1, startedAt: -1 }
 *       <br/>Execution history per schedule, newest first.</li>
 *   <li><b>ttl_expires_at</b> on {@code etl_oauth_states}: { expiresAt: 1 }, expireAfterSeconds 0
 *       <br/>Lets MongoDB drop stale OAuth states.</li>
 *   <li><b>idx_destination_recorded</b> on {@code etl_credential_audit}: { destinationId: 1, recordedAt: 1 }
 *       <br/>Audit trail per destination.</li>
 *   <li><b>idx_error_recorded</b> on {@code etl_error_logs}: { recordedAt: 1 }
 *       <br/>Timeframe match of the error statistics.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.etl_schedules.createIndex({ active: 1, nextRun: 1, lockUntil: 1 }, { name: "idx_due_claim" });
 * db.etl_job_executions.createIndex({ scheduleId: 1, startedAt: -1 }, { name: "idx_schedule_started" });
 * db.etl_oauth_states.createIndex({ expiresAt: 1 }, { name: "ttl_expires_at", expireAfterSeconds: 0 });
 * db.etl_credential_audit.createIndex({ destinationId: 1, recordedAt: 1 }, { name: "idx_destination_recorded" });
 * db.etl_error_logs.createIndex({ recordedAt: 1 }, { name: "idx_error_recorded" });
 * </pre>
 */
public class EtlMongoIndexConfig {

    public static final String IDX_DUE_CLAIM = "idx_due_claim";
    public static final String IDX_SCHEDULE_STARTED = "idx_schedule_started";
    public static final String TTL_EXPIRES_AT = "ttl_expires_at";
    public static final String IDX_DESTINATION_RECORDED = "idx_destination_recorded";
    public static final String IDX_ERROR_RECORDED = "idx_error_recorded";

    private final MongoTemplate mongoTemplate;

    public EtlMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create all required indexes. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(dueClaimIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(scheduleStartedIndex());
        mongoTemplate.indexOps(OAuthStateDocument.class).ensureIndex(stateTtlIndex());
        mongoTemplate.indexOps(CredentialAuditDocument.class).ensureIndex(destinationRecordedIndex());
        mongoTemplate.indexOps(ErrorLogDocument.class).ensureIndex(errorRecordedIndex());
    }

    public static Index dueClaimIndex() {
        return new Index()
                .on("active", Sort.Direction.ASC)
                .on("nextRun", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_DUE_CLAIM);
    }

    public static Index scheduleStartedIndex() {
        return new Index()
                .on("scheduleId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_SCHEDULE_STARTED);
    }

    /**
     * Documents expire at their own {@code expiresAt}.
     */
    public static Index stateTtlIndex() {
        return new Index()
                .on("expiresAt", Sort.Direction.ASC)
                .expire(Duration.ZERO)
                .named(TTL_EXPIRES_AT);
    }

    public static Index destinationRecordedIndex() {
        return new Index()
                .on("destinationId", Sort.Direction.ASC)
                .on("recordedAt", Sort.Direction.ASC)
                .named(IDX_DESTINATION_RECORDED);
    }

    public static Index errorRecordedIndex() {
        return new Index()
                .on("recordedAt", Sort.Direction.ASC)
                .named(IDX_ERROR_RECORDED);
    }
}
