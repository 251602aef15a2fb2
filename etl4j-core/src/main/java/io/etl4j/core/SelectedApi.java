package io.etl4j.core;

import java.util.List;

public record SelectedApi(String name, String endpoint, List<String> selectedFields) {
    public SelectedApi {
        selectedFields = selectedFields == null ? List.of() : List.copyOf(selectedFields);
    }
}
