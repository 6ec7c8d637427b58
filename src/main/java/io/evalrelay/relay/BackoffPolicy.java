package io.evalrelay.relay;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff used while the peer process is still starting.
 */
public record BackoffPolicy(
        Duration initialDelay,
        Duration maxDelay,
        Duration gracePeriod
) {
    public static final long DEFAULT_INITIAL_DELAY_MS = 250L;
    public static final long DEFAULT_MAX_DELAY_MS = 5_000L;
    public static final long DEFAULT_GRACE_PERIOD_MS = 15L * 60L * 1_000L;
    private static final long MAX_JITTER_MS = 250L;

    public BackoffPolicy {
        initialDelay = positiveOr(initialDelay, Duration.ofMillis(DEFAULT_INITIAL_DELAY_MS));
        maxDelay = positiveOr(maxDelay, Duration.ofMillis(DEFAULT_MAX_DELAY_MS));
        if (maxDelay.compareTo(initialDelay) < 0) {
            maxDelay = initialDelay;
        }
        gracePeriod = gracePeriod == null || gracePeriod.isNegative() ? Duration.ZERO : gracePeriod;
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(
                Duration.ofMillis(DEFAULT_INITIAL_DELAY_MS),
                Duration.ofMillis(DEFAULT_MAX_DELAY_MS),
                Duration.ofMillis(DEFAULT_GRACE_PERIOD_MS)
        );
    }

    public BackoffPolicy withGracePeriod(Duration grace) {
        return new BackoffPolicy(initialDelay, maxDelay, grace);
    }

    /**
     * Delay before retry number {@code attempt} (1-based), doubling from the initial delay
     * up to the cap, plus up to 250 ms of jitter.
     */
    public long delayMs(int attempt) {
        long base = initialDelay.toMillis();
        long cap = maxDelay.toMillis();
        long backoff = base;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= cap / 2L) {
                backoff = cap;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, cap);
        long jitter = ThreadLocalRandom.current().nextLong(0L, MAX_JITTER_MS + 1L);
        return Math.min(cap, backoff + jitter);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
