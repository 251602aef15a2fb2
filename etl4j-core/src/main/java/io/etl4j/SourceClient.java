package io.etl4j;

import java.util.List;
import java.util.Map;

/**
 * Reads records from an external source API. Implementations own their auth, rate limiting
 * and retry; any exception they throw fails the extract stage.
 */
public interface SourceClient {

    List<Map<String, Object>> fetch(Map<String, String> credentials, String endpoint, List<String> selectedFields) throws Exception;
}
