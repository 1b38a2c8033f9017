package com.questrail.localtranslate.config;

import com.questrail.localtranslate.error.ErrorKind;

import java.time.Duration;
import java.util.Objects;

/**
 * RetryPolicy
 * -----------------------------------------------------------------------------
 * Retry budget and exponential backoff parameters.
 *
 * <p>This record only answers <em>how many</em> retries a failure kind may
 * have and <em>how long</em> to wait before a given retry. Whether a failure is
 * retried at all is decided by the orchestrator.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>maxRetries</b>: retries allowed after the first attempt for every
 *       kind except {@link ErrorKind#MEMORY}.</li>
 *   <li><b>memoryErrorMaxRetries</b>: retries allowed for memory failures;
 *       usually lower, since repeating a memory-heavy call rarely helps.</li>
 *   <li><b>initialDelay</b>, <b>multiplier</b>, <b>maxDelay</b>: delay before
 *       retrying after attempt {@code n} is
 *       {@code min(initialDelay * multiplier^(n-1), maxDelay)}.</li>
 * </ul>
 */
public record RetryPolicy(
        int maxRetries,
        int memoryErrorMaxRetries,
        Duration initialDelay,
        Duration maxDelay,
        double multiplier
) {
    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");

        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        if (memoryErrorMaxRetries < 0) {
            throw new IllegalArgumentException("memoryErrorMaxRetries must be non-negative");
        }
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a finite value >= 1.0");
        }
    }

    /**
     * Defaults: 3 retries (1 for memory failures), 1s initial delay doubling
     * up to 10s.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 1, Duration.ofMillis(1000), Duration.ofMillis(10_000), 2.0);
    }

    /** No retries at all. */
    public static RetryPolicy none() {
        return new RetryPolicy(0, 0, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public int maxRetriesFor(ErrorKind kind) {
        return kind == ErrorKind.MEMORY ? memoryErrorMaxRetries : maxRetries;
    }

    public int maxAttemptsFor(ErrorKind kind) {
        return maxRetriesFor(kind) + 1;
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt 1-based number of the attempt that failed
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double raw = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(raw, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    public RetryPolicy withMaxRetries(int value) {
        return new RetryPolicy(value, memoryErrorMaxRetries, initialDelay, maxDelay, multiplier);
    }

    public RetryPolicy withMemoryErrorMaxRetries(int value) {
        return new RetryPolicy(maxRetries, value, initialDelay, maxDelay, multiplier);
    }

    public RetryPolicy withDelays(Duration initial, Duration max, double mult) {
        return new RetryPolicy(maxRetries, memoryErrorMaxRetries, initial, max, mult);
    }
}
