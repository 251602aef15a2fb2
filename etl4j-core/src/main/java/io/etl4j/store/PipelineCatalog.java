package io.etl4j.store;

import io.etl4j.core.SourceDefinition;
import io.etl4j.core.TransformationDefinition;

import java.util.Optional;

/**
 * Read access to configured sources and transformations.
 */
public interface PipelineCatalog {

    Optional<SourceDefinition> findSource(String sourceId);

    Optional<TransformationDefinition> findTransformation(String transformationId);
}
