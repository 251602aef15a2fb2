package io.etl4j.retry;

import io.etl4j.error.EtlException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Bounded retry loop shared by token exchange and destination upload.
 *
 * <p>A call is attempted at most {@code maxAttempts} times. A failure is retried only when the
 * predicate accepts it; the delay before attempt {@code n + 1} is {@code backoff.apply(n)}.
 * Every retry is reported to the listener before sleeping.
 */
public final class RetryPolicy {

    /**
     * Observes retries, e.g. to write them into an execution record.
     */
    @FunctionalInterface
    public interface Listener {
        void onRetry(int failedAttempt, int maxAttempts, Duration delay, Throwable failure);

        Listener NONE = (a, m, d, f) -> {
        };
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;

        Sleeper THREAD = d -> Thread.sleep(d.toMillis());
    }

    private final int maxAttempts;
    private final IntFunction<Duration> backoff;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, IntFunction<Duration> backoff, Predicate<Throwable> retryable, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.retryable = Objects.requireNonNull(retryable, "retryable must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Delay of {@code base * attempt}: 1s, 2s, 3s for a 1s base.
     */
    public static IntFunction<Duration> linear(Duration base) {
        return attempt -> base.multipliedBy(attempt);
    }

    /**
     * Delay of {@code base * 2^(attempt-1)}, capped at {@code max}.
     */
    public static IntFunction<Duration> exponential(Duration base, Duration max) {
        return attempt -> {
            int exp = Math.max(0, Math.min(attempt - 1, 20));
            Duration d = base.multipliedBy(1L << exp);
            return d.compareTo(max) > 0 ? max : d;
        };
    }

    /**
     * Retries {@link EtlException}s flagged retryable and nothing else.
     */
    public static Predicate<Throwable> retryableEtlErrors() {
        return t -> t instanceof EtlException e && e.isRetryable();
    }

    public static RetryPolicy linear(int maxAttempts, Duration base, Predicate<Throwable> retryable) {
        return new RetryPolicy(maxAttempts, linear(base), retryable, Sleeper.THREAD);
    }

    public RetryPolicy withSleeper(Sleeper s) {
        return new RetryPolicy(maxAttempts, backoff, retryable, s);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(Callable<T> call) throws Exception {
        return execute(call, Listener.NONE);
    }

    /**
     * Run {@code call}, rethrowing the last failure unchanged once attempts are exhausted or the
     * failure is not retryable.
     */
    public <T> T execute(Callable<T> call, Listener listener) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                Duration delay = backoff.apply(attempt);
                listener.onRetry(attempt, maxAttempts, delay, e);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }
}
