package io.etl4j.internal.mongo;

import io.etl4j.core.AuditAction;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "etl_credential_audit")
public class CredentialAuditDocument {

    @Id
    private String id;

    private String destinationId;
    private AuditAction action;
    private Map<String, Object> oldCredentials;
    private Map<String, Object> newCredentials;
    private Instant recordedAt;

    public CredentialAuditDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDestinationId() {
        return destinationId;
    }

    public void setDestinationId(String destinationId) {
        this.destinationId = destinationId;
    }

    public AuditAction getAction() {
        return action;
    }

    public void setAction(AuditAction action) {
        this.action = action;
    }

    public Map<String, Object> getOldCredentials() {
        return oldCredentials;
    }

    public void setOldCredentials(Map<String, Object> oldCredentials) {
        this.oldCredentials = oldCredentials;
    }

    public Map<String, Object> getNewCredentials() {
        return newCredentials;
    }

    public void setNewCredentials(Map<String, Object> newCredentials) {
        this.newCredentials = newCredentials;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public void setRecordedAt(Instant recordedAt) {
        this.recordedAt = recordedAt;
    }
}
