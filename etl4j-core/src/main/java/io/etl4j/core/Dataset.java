package io.etl4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records grouped by the API they were extracted from, in extraction order.
 */
public final class Dataset {

    private final Map<String, List<Map<String, Object>>> recordsByApi;

    public Dataset(Map<String, List<Map<String, Object>>> recordsByApi) {
        LinkedHashMap<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
        if (recordsByApi != null) {
            recordsByApi.forEach((api, records) -> copy.put(api, records == null ? List.of() : List.copyOf(records)));
        }
        this.recordsByApi = Collections.unmodifiableMap(copy);
    }

    public static Dataset empty() {
        return new Dataset(Map.of());
    }

    public Map<String, List<Map<String, Object>>> recordsByApi() {
        return recordsByApi;
    }

    public List<Map<String, Object>> records(String api) {
        return recordsByApi.getOrDefault(api, List.of());
    }

    public int recordCount() {
        return recordsByApi.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Dataset other && recordsByApi.equals(other.recordsByApi);
    }

    @Override
    public int hashCode() {
        return recordsByApi.hashCode();
    }

    @Override
    public String toString() {
        return "Dataset{apis=" + recordsByApi.keySet() + ", records=" + recordCount() + "}";
    }
}
