package io.etl4j.pipeline;

import java.util.Collection;
import java.util.Map;

public enum FieldType {
    NUMBER,
    STRING,
    BOOLEAN,
    OBJECT,
    ARRAY;

    public boolean matches(Object value) {
        return switch (this) {
            case NUMBER -> value instanceof Number;
            case STRING -> value instanceof String;
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT -> value instanceof Map<?, ?>;
            case ARRAY -> value instanceof Collection<?> || (value != null && value.getClass().isArray());
        };
    }

    public static FieldType of(Object value) {
        for (FieldType t : values()) {
            if (t.matches(value)) {
                return t;
            }
        }
        return null;
    }
}
