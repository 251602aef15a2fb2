package io.etl4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.etl4j.core.Schedule;
import io.etl4j.store.ScheduleStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for schedules.
 *
 * <p>Claims set {@code lockedAt / lockUntil / lockedBy} with {@code findAndModify}, so at most one
 * worker holds a schedule until it releases it or the lock expires.
 */
public class MongoScheduleStore implements ScheduleStore {

    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoScheduleStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<Schedule> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, ScheduleDocument.class)).map(MongoScheduleStore::toSchedule);
    }

    @Override
    public List<Schedule> findActive() {
        Query q = new Query(Criteria.where("active").is(true));
        q.with(Sort.by(Sort.Order.asc("nextRun")));
        return mongoTemplate.find(q, ScheduleDocument.class).stream().map(MongoScheduleStore::toSchedule).toList();
    }

    /**
     * Inserts when the id is null, otherwise upserts the definition fields by id. Lock fields are
     * left untouched so a save never steals or drops a claim.
     */
    @Override
    public Schedule save(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");

        if (schedule.id() == null) {
            ScheduleDocument doc = toDocument(schedule);
            mongoTemplate.insert(doc);
            return schedule.withId(doc.getId());
        }

        Update u = new Update()
                .set("ownerId", schedule.ownerId())
                .set("sourceId", schedule.sourceId())
                .set("transformationId", schedule.transformationId())
                .set("destinationId", schedule.destinationId())
                .set("frequency", schedule.frequency())
                .set("timeOfDay", schedule.timeOfDay().format(TIME_OF_DAY))
                .set("dayOfWeek", schedule.dayOfWeek())
                .set("dayOfMonth", schedule.dayOfMonth())
                .set("timezone", schedule.timezone())
                .set("lastRun", schedule.lastRun())
                .set("nextRun", schedule.nextRun())
                .set("active", schedule.active())
                .set("consecutiveFailures", schedule.consecutiveFailures());

        mongoTemplate.upsert(byId(schedule.id()), u, ScheduleDocument.class);
        return schedule;
    }

    @Override
    public List<Schedule> claimDue(Instant windowEnd, int limit, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        requireLock(lockLifetime, workerId);
        if (limit <= 0) {
            return List.of();
        }

        Instant now = clock.instant();

        Query baseQuery = new Query(
                Criteria.where("active").is(true)
                        .and("nextRun").ne(null).lte(windowEnd)
                        .andOperator(lockFree(now))
        );
        baseQuery.with(Sort.by(Sort.Order.asc("nextRun")));

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);
        Update lockUpdate = lockUpdate(now, lockLifetime, workerId);

        List<Schedule> claimed = new ArrayList<>(Math.min(limit, 64));
        for (int i = 0; i < limit; i++) {
            ScheduleDocument doc = mongoTemplate.findAndModify(baseQuery, lockUpdate, options, ScheduleDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(toSchedule(doc));
        }
        return claimed;
    }

    /**
     * A worker may re-claim a schedule it already holds, so a manual run can take over the claim
     * of a trigger that is still waiting in the same process.
     */
    @Override
    public Optional<Schedule> claim(String id, Duration lockLifetime, String workerId, Instant now) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(now, "now must not be null");
        requireLock(lockLifetime, workerId);

        Query q = new Query(
                Criteria.where("_id").is(id)
                        .and("active").is(true)
                        .orOperator(
                                Criteria.where("lockUntil").is(null),
                                Criteria.where("lockUntil").lte(now),
                                Criteria.where("lockedBy").is(workerId)
                        )
        );

        ScheduleDocument doc = mongoTemplate.findAndModify(q, lockUpdate(now, lockLifetime, workerId),
                FindAndModifyOptions.options().returnNew(true), ScheduleDocument.class);
        return Optional.ofNullable(doc).map(MongoScheduleStore::toSchedule);
    }

    @Override
    public void recordSuccess(String id, Instant lastRun, Instant nextRun) {
        Objects.requireNonNull(id, "id must not be null");
        Update u = new Update()
                .set("lastRun", lastRun)
                .set("nextRun", nextRun)
                .set("consecutiveFailures", 0);
        mongoTemplate.updateFirst(byId(id), u, ScheduleDocument.class);
    }

    @Override
    public int recordFailure(String id, Instant nextRun, boolean pause) {
        Objects.requireNonNull(id, "id must not be null");
        Update u = new Update()
                .set("nextRun", nextRun)
                .inc("consecutiveFailures", 1);
        if (pause) {
            u.set("active", false);
        }

        ScheduleDocument doc = mongoTemplate.findAndModify(byId(id), u,
                FindAndModifyOptions.options().returnNew(true), ScheduleDocument.class);
        return doc == null ? 0 : doc.getConsecutiveFailures();
    }

    @Override
    public boolean extendClaim(String id, String workerId, Duration lockLifetime, Instant now) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(now, "now must not be null");
        requireLock(lockLifetime, workerId);

        Query q = new Query(
                Criteria.where("_id").is(id)
                        .and("lockedBy").is(workerId)
        );
        Update u = new Update().set("lockUntil", now.plus(lockLifetime));
        return mongoTemplate.updateFirst(q, u, ScheduleDocument.class).getMatchedCount() > 0;
    }

    @Override
    public void release(String id, String workerId) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Query q = new Query(
                Criteria.where("_id").is(id)
                        // A lock that expired and was re-claimed elsewhere belongs to the new holder.
                        .and("lockedBy").is(workerId)
        );
        Update u = new Update()
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");
        mongoTemplate.updateFirst(q, u, ScheduleDocument.class);
    }

    @Override
    public boolean deactivate(String id) {
        Objects.requireNonNull(id, "id must not be null");
        UpdateResult r = mongoTemplate.updateFirst(byId(id), new Update().set("active", false), ScheduleDocument.class);
        return r.getMatchedCount() > 0;
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static Criteria lockFree(Instant now) {
        return new Criteria().orOperator(
                Criteria.where("lockUntil").is(null),
                Criteria.where("lockUntil").lte(now)
        );
    }

    private static Update lockUpdate(Instant now, Duration lockLifetime, String workerId) {
        return new Update()
                .set("lockedAt", now)
                .set("lockUntil", now.plus(lockLifetime))
                .set("lockedBy", workerId);
    }

    private static void requireLock(Duration lockLifetime, String workerId) {
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
    }

    static ScheduleDocument toDocument(Schedule s) {
        ScheduleDocument doc = new ScheduleDocument();
        doc.setId(s.id());
        doc.setOwnerId(s.ownerId());
        doc.setSourceId(s.sourceId());
        doc.setTransformationId(s.transformationId());
        doc.setDestinationId(s.destinationId());
        doc.setFrequency(s.frequency());
        doc.setTimeOfDay(s.timeOfDay().format(TIME_OF_DAY));
        doc.setDayOfWeek(s.dayOfWeek());
        doc.setDayOfMonth(s.dayOfMonth());
        doc.setTimezone(s.timezone());
        doc.setLastRun(s.lastRun());
        doc.setNextRun(s.nextRun());
        doc.setActive(s.active());
        doc.setConsecutiveFailures(s.consecutiveFailures());
        return doc;
    }

    static Schedule toSchedule(ScheduleDocument doc) {
        return new Schedule(
                doc.getId(),
                doc.getOwnerId(),
                doc.getSourceId(),
                doc.getTransformationId(),
                doc.getDestinationId(),
                doc.getFrequency(),
                LocalTime.parse(doc.getTimeOfDay()),
                doc.getDayOfWeek(),
                doc.getDayOfMonth(),
                doc.getTimezone(),
                doc.getLastRun(),
                doc.getNextRun(),
                doc.isActive(),
                doc.getConsecutiveFailures()
        );
    }
}
