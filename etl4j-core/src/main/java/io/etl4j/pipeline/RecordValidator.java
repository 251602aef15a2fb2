package io.etl4j.pipeline;

import io.etl4j.core.Dataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks every record of a dataset and reports all violations rather than stopping at the first.
 */
public class RecordValidator {

    private final ValidationRules rules;

    public RecordValidator(ValidationRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    public ValidationResult validate(Dataset dataset) {
        List<Violation> violations = new ArrayList<>();
        dataset.recordsByApi().forEach((api, records) -> {
            for (int i = 0; i < records.size(); i++) {
                check(api, i, records.get(i), violations);
            }
        });
        return new ValidationResult(violations);
    }

    private void check(String api, int index, Map<String, Object> record, List<Violation> out) {
        for (String field : rules.requiredFields()) {
            if (record.get(field) == null) {
                out.add(new Violation(api, index, field, "is required"));
            }
        }
        rules.fieldTypes().forEach((field, type) -> {
            Object value = record.get(field);
            if (value != null && !type.matches(value)) {
                FieldType actual = FieldType.of(value);
                out.add(new Violation(api, index, field, "expected " + type + " but was "
                        + (actual != null ? actual : value.getClass().getSimpleName())));
            }
        });
    }
}
