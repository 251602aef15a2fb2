package io.etl4j.pipeline;

/**
 * One failed rule on one record.
 */
public record Violation(String api, int recordIndex, String field, String problem) {

    @Override
    public String toString() {
        return api + "[" + recordIndex + "]." + field + " " + problem;
    }
}
