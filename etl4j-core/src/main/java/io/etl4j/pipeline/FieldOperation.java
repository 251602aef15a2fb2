package io.etl4j.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.etl4j.error.TransformationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One configured field-level transformation.
 *
 * <p>Config shape: {@code {"type": "CAST", "api": "orders", "field": "total", "configuration": {...}}}.
 * {@code api} is optional; without it the operation applies to every API of the dataset.
 */
public interface FieldOperation {

    String api();

    String field();

    /**
     * Mutates {@code record} in place.
     */
    void apply(Map<String, Object> record, ObjectMapper mapper);

    default boolean appliesTo(String apiName) {
        return api() == null || api().equals(apiName);
    }

    /**
     * {@code configuration.targetType}: NUMBER, STRING or BOOLEAN. Null values stay null.
     */
    record Cast(String api, String field, FieldType targetType) implements FieldOperation {
        @Override
        public void apply(Map<String, Object> record, ObjectMapper mapper) {
            Object value = record.get(field);
            if (value == null) {
                return;
            }
            record.put(field, switch (targetType) {
                case NUMBER -> toNumber(value);
                case STRING -> value instanceof String s ? s : String.valueOf(value);
                case BOOLEAN -> toBoolean(value);
                default -> throw new TransformationException("Unsupported cast target " + targetType + " for field " + field);
            });
        }

        private Object toNumber(Object value) {
            if (value instanceof Number n) {
                return n;
            }
            if (value instanceof Boolean b) {
                return b ? 1 : 0;
            }
            String s = String.valueOf(value).trim();
            try {
                BigDecimal d = new BigDecimal(s);
                if (d.stripTrailingZeros().scale() <= 0) {
                    return d.toBigInteger().bitLength() < 64 ? (Object) d.longValueExact() : d;
                }
                return d.doubleValue();
            } catch (NumberFormatException e) {
                throw new TransformationException("Cannot cast field " + field + " to NUMBER",
                        Map.of("field", field, "value", s), e);
            }
        }

        private Object toBoolean(Object value) {
            if (value instanceof Boolean b) {
                return b;
            }
            if (value instanceof Number n) {
                return n.doubleValue() != 0;
            }
            String s = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
            return switch (s) {
                case "true", "1", "yes" -> true;
                case "false", "0", "no", "" -> false;
                default -> throw new TransformationException("Cannot cast field " + field + " to BOOLEAN",
                        Map.of("field", field, "value", s));
            };
        }
    }

    /**
     * Replaces the value with its JSON text.
     */
    record Stringify(String api, String field) implements FieldOperation {
        @Override
        public void apply(Map<String, Object> record, ObjectMapper mapper) {
            if (!record.containsKey(field)) {
                return;
            }
            try {
                record.put(field, mapper.writeValueAsString(record.get(field)));
            } catch (JsonProcessingException e) {
                throw new TransformationException("Cannot stringify field " + field, Map.of("field", field), e);
            }
        }
    }

    /**
     * Joins {@code configuration.fields} with {@code configuration.separator} (default one space)
     * into {@code field}. Missing source values are skipped.
     */
    record Concatenate(String api, String field, List<String> sources, String separator) implements FieldOperation {
        public Concatenate {
            sources = List.copyOf(sources);
        }

        @Override
        public void apply(Map<String, Object> record, ObjectMapper mapper) {
            String joined = sources.stream()
                    .map(record::get)
                    .filter(Objects::nonNull)
                    .map(String::valueOf)
                    .collect(Collectors.joining(separator));
            record.put(field, joined);
        }
    }

    /**
     * Build an operation from its stored configuration.
     *
     * @throws TransformationException for an unknown type or incomplete configuration
     */
    static FieldOperation parse(Map<String, Object> config) {
        Object rawType = config.get("type");
        if (rawType == null) {
            throw new TransformationException("Transformation operation has no type", Map.of("operation", config.toString()));
        }
        String type = String.valueOf(rawType).trim().toUpperCase(Locale.ROOT);
        String api = config.get("api") == null ? null : String.valueOf(config.get("api"));
        Object rawField = config.get("field");
        if (rawField == null || String.valueOf(rawField).isBlank()) {
            throw new TransformationException("Transformation operation " + type + " has no field");
        }
        String field = String.valueOf(rawField);
        Map<?, ?> conf = config.get("configuration") instanceof Map<?, ?> m ? m : Map.of();

        return switch (type) {
            case "CAST" -> {
                Object target = conf.get("targetType");
                if (target == null) {
                    throw new TransformationException("CAST of field " + field + " has no targetType");
                }
                FieldType targetType;
                try {
                    targetType = FieldType.valueOf(String.valueOf(target).trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new TransformationException("Unsupported cast target: " + target, Map.of("field", field), e);
                }
                yield new Cast(api, field, targetType);
            }
            case "STRINGIFY" -> new Stringify(api, field);
            case "CONCATENATE" -> {
                if (!(conf.get("fields") instanceof List<?> list) || list.isEmpty()) {
                    throw new TransformationException("CONCATENATE into " + field + " needs a non-empty fields list");
                }
                List<String> sources = new ArrayList<>();
                list.forEach(o -> sources.add(String.valueOf(o)));
                Object sep = conf.get("separator");
                yield new Concatenate(api, field, sources, sep == null ? " " : String.valueOf(sep));
            }
            default -> throw new TransformationException("Unknown transformation type: " + rawType,
                    Map.of("type", String.valueOf(rawType)));
        };
    }
}
