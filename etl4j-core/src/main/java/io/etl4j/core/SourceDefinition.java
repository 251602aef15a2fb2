package io.etl4j.core;

import java.util.List;
import java.util.Map;

/**
 * A configured source: its credentials and the APIs (with fields) selected for extraction.
 */
public record SourceDefinition(String id, String ownerId, Map<String, String> credentials, List<SelectedApi> selectedApis) {
    public SourceDefinition {
        credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
        selectedApis = selectedApis == null ? List.of() : List.copyOf(selectedApis);
    }

    @Override
    public String toString() {
        return "SourceDefinition[id=" + id + ", ownerId=" + ownerId + ", selectedApis=" + selectedApis + "]";
    }
}
