package io.etl4j.internal.mongo;

import io.etl4j.core.SelectedApi;
import io.etl4j.core.SourceDefinition;
import io.etl4j.core.TransformationDefinition;
import io.etl4j.store.PipelineCatalog;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads active sources and transformations.
 */
public class MongoPipelineCatalog implements PipelineCatalog {

    private final MongoTemplate mongoTemplate;

    public MongoPipelineCatalog(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<SourceDefinition> findSource(String sourceId) {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        SourceDocument doc = mongoTemplate.findOne(activeById(sourceId), SourceDocument.class);
        if (doc == null) {
            return Optional.empty();
        }
        List<SelectedApi> apis = doc.getSelectedApis() == null ? List.of() : doc.getSelectedApis().stream()
                .map(a -> new SelectedApi(a.getName(), a.getEndpoint(), a.getSelectedFields()))
                .toList();
        return Optional.of(new SourceDefinition(doc.getId(), doc.getOwnerId(), doc.getCredentials(), apis));
    }

    @Override
    public Optional<TransformationDefinition> findTransformation(String transformationId) {
        Objects.requireNonNull(transformationId, "transformationId must not be null");
        TransformationDocument doc = mongoTemplate.findOne(activeById(transformationId), TransformationDocument.class);
        return Optional.ofNullable(doc)
                .map(d -> new TransformationDefinition(d.getId(), d.getSourceId(), d.getOperations()));
    }

    private static Query activeById(String id) {
        return new Query(Criteria.where("_id").is(id).and("active").is(true));
    }
}
