package io.etl4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;
import java.util.Map;

@Document(collection = "etl_transformations")
public class TransformationDocument {

    @Id
    private String id;

    private String sourceId;
    private List<Map<String, Object>> operations;
    private boolean active;

    public TransformationDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public List<Map<String, Object>> getOperations() {
        return operations;
    }

    public void setOperations(List<Map<String, Object>> operations) {
        this.operations = operations;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
