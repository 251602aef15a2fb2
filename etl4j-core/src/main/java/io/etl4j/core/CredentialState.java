package io.etl4j.core;

public enum CredentialState {
    UNAUTHORIZED,
    AUTHORIZING,
    AUTHORIZED,
    REVOKED
}
