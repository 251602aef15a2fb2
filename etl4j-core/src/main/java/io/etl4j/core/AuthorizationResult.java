package io.etl4j.core;

public record AuthorizationResult(String destinationId, long expiresIn) {
}
