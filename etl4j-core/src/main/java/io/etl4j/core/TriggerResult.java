package io.etl4j.core;

public enum TriggerResult {
    STARTED,
    COALESCED,
    NOT_FOUND
}
