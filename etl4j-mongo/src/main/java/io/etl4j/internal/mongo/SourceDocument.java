package io.etl4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;
import java.util.Map;

@Document(collection = "etl_sources")
public class SourceDocument {

    @Id
    private String id;

    private String ownerId;
    private Map<String, String> credentials;
    private List<SelectedApiEntry> selectedApis;
    private boolean active;

    public SourceDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public Map<String, String> getCredentials() {
        return credentials;
    }

    public void setCredentials(Map<String, String> credentials) {
        this.credentials = credentials;
    }

    public List<SelectedApiEntry> getSelectedApis() {
        return selectedApis;
    }

    public void setSelectedApis(List<SelectedApiEntry> selectedApis) {
        this.selectedApis = selectedApis;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public static class SelectedApiEntry {
        private String name;
        private String endpoint;
        private List<String> selectedFields;

        public SelectedApiEntry() {
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public List<String> getSelectedFields() {
            return selectedFields;
        }

        public void setSelectedFields(List<String> selectedFields) {
            this.selectedFields = selectedFields;
        }
    }
}
