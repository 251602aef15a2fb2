package io.etl4j.error;

import io.etl4j.core.ErrorLogEntry;
import io.etl4j.core.ErrorStats;
import io.etl4j.store.ErrorLogStore;
import io.etl4j.testing.InMemoryErrorLogStore;
import io.etl4j.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class ErrorLoggerTest {

    private static final Instant T0 = Instant.parse("2026-10-12T08:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryErrorLogStore store = new InMemoryErrorLogStore();
    private final ErrorLogger errorLogger = new ErrorLogger(store, clock);

    @Test
    void etlFailureShouldBeStoredWithCodeDetailsAndContext() {
        TokenException failure = new TokenException("Refresh token rejected by provider",
                Map.of("destinationId", "dst-1"), new ProviderException("HTTP 401", 401, Map.of(), null));

        errorLogger.logError(failure, Map.of("operation", "refreshTokens", "destinationId", "dst-1"));

        ErrorLogEntry entry = store.entries().get(0);
        assertEquals("TokenException", entry.errorType());
        assertEquals("TOKEN_ERROR", entry.errorCode());
        assertEquals("refreshTokens", entry.context().get("operation"));
        assertEquals(Map.of("destinationId", "dst-1"), entry.details().get("details"));
        assertTrue(entry.details().get("causes").toString().contains("HTTP 401"));
        assertEquals(T0, entry.recordedAt());
    }

    @Test
    void plainFailureShouldBeStoredWithoutCode() {
        errorLogger.logError(new IllegalStateException("boom", new IOException("disk full")), Map.of());

        ErrorLogEntry entry = store.entries().get(0);
        assertEquals("IllegalStateException", entry.errorType());
        assertNull(entry.errorCode());
        assertTrue(entry.details().get("causes").toString().contains("disk full"));
    }

    @Test
    void failingStoreShouldNotPropagate() {
        ErrorLogStore broken = mock(ErrorLogStore.class);
        doThrow(new IllegalStateException("store down")).when(broken).append(any());

        assertDoesNotThrow(() -> new ErrorLogger(broken, clock)
                .logError(new StateException("Invalid or expired authorization state"), Map.of("operation", "handleCallback")));
    }

    @Test
    void statsShouldGroupByTypeAndCodeWithinTimeframe() {
        errorLogger.logError(new StateException("old"), Map.of());
        clock.advance(Duration.ofHours(30));
        errorLogger.logError(new StateException("reused state"), Map.of());
        clock.advance(Duration.ofMinutes(5));
        errorLogger.logError(new StateException("expired state"), Map.of());
        errorLogger.logError(new ConfigException("missing clientId"), Map.of());

        List<ErrorStats> stats = errorLogger.getErrorStats(Duration.ofHours(24));

        assertEquals(2, stats.size());
        ErrorStats top = stats.get(0);
        assertEquals("StateException", top.errorType());
        assertEquals("STATE_ERROR", top.errorCode());
        assertEquals(2, top.count());
        assertEquals(T0.plus(Duration.ofHours(30)), top.firstOccurrence());
        assertEquals(T0.plus(Duration.ofHours(30)).plus(Duration.ofMinutes(5)), top.lastOccurrence());
        assertEquals(1, stats.get(1).count());
    }

    @Test
    void negativeTimeframeShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> errorLogger.getErrorStats(Duration.ofHours(-1)));
    }
}
