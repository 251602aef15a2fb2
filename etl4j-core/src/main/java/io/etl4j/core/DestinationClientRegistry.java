package io.etl4j.core;

import io.etl4j.DestinationClient;
import io.etl4j.error.DestinationException;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public class DestinationClientRegistry {

    private final Map<String, DestinationClient> clientsByType;

    public DestinationClientRegistry(List<DestinationClient> clients) {
        this.clientsByType = clients.stream()
                .collect(Collectors.toUnmodifiableMap(
                        DestinationClient::type,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate DestinationClient type: " + a.type());
                        }
                ));
    }

    public DestinationClient getRequired(String type) {
        DestinationClient client = type == null ? null : clientsByType.get(type);
        if (client == null) {
            throw new DestinationException("No DestinationClient registered for type: " + type,
                    Map.of("type", String.valueOf(type)), null);
        }
        return client;
    }
}
