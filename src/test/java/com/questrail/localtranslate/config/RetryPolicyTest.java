package com.questrail.localtranslate.config;

import com.questrail.localtranslate.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicyTest
 * -----------------------------------------------------------------------------
 * Backoff arithmetic and per-kind retry budgets.
 */
class RetryPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(3, policy.maxRetries());
        assertEquals(1, policy.memoryErrorMaxRetries());
        assertEquals(Duration.ofMillis(1000), policy.initialDelay());
        assertEquals(Duration.ofMillis(10_000), policy.maxDelay());
        assertEquals(2.0, policy.multiplier());
    }

    @Test
    void delaysGrowExponentiallyUpToTheCap() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(1000, policy.delayForAttempt(1).toMillis());
        assertEquals(2000, policy.delayForAttempt(2).toMillis());
        assertEquals(4000, policy.delayForAttempt(3).toMillis());
        assertEquals(8000, policy.delayForAttempt(4).toMillis());
        assertEquals(10_000, policy.delayForAttempt(5).toMillis());
        assertEquals(10_000, policy.delayForAttempt(50).toMillis());
    }

    @Test
    void delaysAreNonDecreasing() {
        RetryPolicy policy = RetryPolicy.defaults().withDelays(Duration.ofMillis(250), Duration.ofMillis(3000), 1.5);

        long previous = 0;
        for (int attempt = 1; attempt <= 20; attempt++) {
            long delay = policy.delayForAttempt(attempt).toMillis();
            assertTrue(delay >= previous);
            assertTrue(delay <= 3000);
            previous = delay;
        }
    }

    @Test
    void memoryFailuresHaveTheirOwnBudget() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(1, policy.maxRetriesFor(ErrorKind.MEMORY));
        assertEquals(2, policy.maxAttemptsFor(ErrorKind.MEMORY));
        assertEquals(3, policy.maxRetriesFor(ErrorKind.NETWORK));
        assertEquals(4, policy.maxAttemptsFor(ErrorKind.TIMEOUT));
    }

    @Test
    void noneNeverRetries() {
        RetryPolicy policy = RetryPolicy.none();

        assertEquals(0, policy.maxRetriesFor(ErrorKind.UNKNOWN));
        assertEquals(0, policy.maxRetriesFor(ErrorKind.MEMORY));
    }

    @Test
    void rejectsInvalidParameters() {
        Duration second = Duration.ofSeconds(1);
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, 1, second, second, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, -1, second, second, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 1, second.negated(), second, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 1, second, Duration.ofMillis(10), 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 1, second, second, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 1, second, second, Double.NaN));
        assertThrows(NullPointerException.class, () -> new RetryPolicy(3, 1, null, second, 2.0));
    }

    @Test
    void delayForAttemptRejectsZero() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().delayForAttempt(0));
    }

    @Test
    void copiesChangeOnlyTheNamedField() {
        RetryPolicy policy = RetryPolicy.defaults().withMaxRetries(5).withMemoryErrorMaxRetries(0);

        assertEquals(5, policy.maxRetries());
        assertEquals(0, policy.memoryErrorMaxRetries());
        assertEquals(RetryPolicy.defaults().initialDelay(), policy.initialDelay());
    }
}
