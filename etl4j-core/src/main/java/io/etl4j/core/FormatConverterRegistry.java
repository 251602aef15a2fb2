package io.etl4j.core;

import io.etl4j.FormatConverter;
import io.etl4j.error.FormatException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public class FormatConverterRegistry {

    private final Map<String, FormatConverter> convertersByFormat;

    public FormatConverterRegistry(List<FormatConverter> converters) {
        this.convertersByFormat = converters.stream()
                .collect(Collectors.toUnmodifiableMap(
                        c -> normalize(c.format()),
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate FormatConverter format: " + a.format());
                        }
                ));
    }

    public FormatConverter getRequired(String format) {
        FormatConverter converter = format == null ? null : convertersByFormat.get(normalize(format));
        if (converter == null) {
            throw new FormatException("Unsupported file format: " + format,
                    Map.of("format", String.valueOf(format), "supported", supportedFormats()));
        }
        return converter;
    }

    public Set<String> supportedFormats() {
        return convertersByFormat.keySet();
    }

    private static String normalize(String format) {
        return format.trim().toLowerCase(Locale.ROOT);
    }
}
