package io.etl4j.error;

import io.etl4j.pipeline.Violation;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Extracted records broke the validation rules. Carries every violation, not just the first.
 */
public class ValidationException extends EtlException {

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super(buildMessage(violations), "VALIDATION_ERROR",
                Map.of("violations", violations.stream().map(Violation::toString).collect(Collectors.toList())),
                false, null);
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    private static String buildMessage(List<Violation> violations) {
        return "Data validation failed: " + violations.stream()
                .map(Violation::toString)
                .collect(Collectors.joining(", "));
    }
}
