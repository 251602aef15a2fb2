package io.etl4j.internal.mongo;

import io.etl4j.core.ErrorLogEntry;
import io.etl4j.core.ErrorStats;
import io.etl4j.store.ErrorLogStore;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Append-only error log in {@code etl_error_logs}. Statistics are computed server side with one
 * aggregation.
 */
public class MongoErrorLogStore implements ErrorLogStore {

    private final MongoTemplate mongoTemplate;

    public MongoErrorLogStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void append(ErrorLogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        ErrorLogDocument doc = new ErrorLogDocument();
        doc.setErrorType(entry.errorType());
        doc.setErrorCode(entry.errorCode());
        doc.setMessage(entry.message());
        doc.setDetails(new LinkedHashMap<>(entry.details()));
        doc.setContext(new LinkedHashMap<>(entry.context()));
        doc.setRecordedAt(entry.recordedAt());
        mongoTemplate.insert(doc);
    }

    @Override
    public List<ErrorStats> statsSince(Instant since) {
        Objects.requireNonNull(since, "since must not be null");
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(Criteria.where("recordedAt").gt(since)),
                Aggregation.group("errorType", "errorCode")
                        .count().as("count")
                        .min("recordedAt").as("firstOccurrence")
                        .max("recordedAt").as("lastOccurrence"),
                Aggregation.sort(Sort.by(Sort.Order.desc("count")))
        );
        return mongoTemplate.aggregate(aggregation, ErrorLogDocument.class, Document.class)
                .getMappedResults().stream()
                .map(MongoErrorLogStore::toStats)
                .toList();
    }

    private static ErrorStats toStats(Document row) {
        Document key = row.get("_id", Document.class);
        return new ErrorStats(
                key.getString("errorType"),
                key.getString("errorCode"),
                ((Number) row.get("count")).longValue(),
                row.get("firstOccurrence", Date.class).toInstant(),
                row.get("lastOccurrence", Date.class).toInstant()
        );
    }
}
