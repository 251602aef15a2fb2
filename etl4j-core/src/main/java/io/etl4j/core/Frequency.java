package io.etl4j.core;

public enum Frequency {
    DAILY,
    WEEKLY,
    MONTHLY
}
