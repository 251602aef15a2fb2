package io.etl4j.core;

public enum JobStatus {
    PENDING,
    STARTED,
    EXTRACTING,
    VALIDATING,
    TRANSFORMING,
    FORMATTING,
    UPLOADING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
