package io.etl4j.core;

public enum AuditAction {
    AUTHORIZATION_REQUESTED,
    AUTHORIZED,
    REFRESHED,
    REVOKED
}
