package io.evalrelay.config;

import io.evalrelay.model.OrderingMode;
import io.evalrelay.relay.BackoffPolicy;

import java.time.Duration;

/**
 * Tunables read from {@code evalrelay-settings.json}; absent fields keep their defaults.
 */
public record RelaySettings(
        long callDeadlineMs,
        long startupGraceMs,
        long backoffInitialMs,
        long backoffMaxMs,
        int maxFrameBytes,
        OrderingMode orderingMode,
        Long orderSeed
) {
    public static final long DEFAULT_CALL_DEADLINE_MS = 6L * 60L * 1_000L;
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    public static RelaySettings defaults() {
        return new RelaySettings(
                DEFAULT_CALL_DEADLINE_MS,
                BackoffPolicy.DEFAULT_GRACE_PERIOD_MS,
                BackoffPolicy.DEFAULT_INITIAL_DELAY_MS,
                BackoffPolicy.DEFAULT_MAX_DELAY_MS,
                DEFAULT_MAX_FRAME_BYTES,
                OrderingMode.RANDOM,
                null
        );
    }

    static RelaySettings fromFile(RelaySettingsFile file, RelaySettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new RelaySettings(
                file.callDeadlineMs() == null ? defaults.callDeadlineMs() : Math.max(1L, file.callDeadlineMs()),
                file.startupGraceMs() == null ? defaults.startupGraceMs() : Math.max(0L, file.startupGraceMs()),
                file.backoffInitialMs() == null ? defaults.backoffInitialMs() : Math.max(1L, file.backoffInitialMs()),
                file.backoffMaxMs() == null ? defaults.backoffMaxMs() : Math.max(1L, file.backoffMaxMs()),
                file.maxFrameBytes() == null ? defaults.maxFrameBytes() : Math.max(1_024, file.maxFrameBytes()),
                file.orderingMode() == null ? defaults.orderingMode() : OrderingMode.fromString(file.orderingMode()),
                file.orderSeed() == null ? defaults.orderSeed() : file.orderSeed()
        );
    }

    public RelaySettings withCallDeadlineMs(long value) {
        return new RelaySettings(Math.max(1L, value), startupGraceMs, backoffInitialMs, backoffMaxMs, maxFrameBytes, orderingMode, orderSeed);
    }

    public RelaySettings withStartupGraceMs(long value) {
        return new RelaySettings(callDeadlineMs, Math.max(0L, value), backoffInitialMs, backoffMaxMs, maxFrameBytes, orderingMode, orderSeed);
    }

    public RelaySettings withOrdering(OrderingMode mode, Long seed) {
        return new RelaySettings(callDeadlineMs, startupGraceMs, backoffInitialMs, backoffMaxMs, maxFrameBytes, mode, seed);
    }

    public Duration callDeadline() {
        return Duration.ofMillis(callDeadlineMs);
    }

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(
                Duration.ofMillis(backoffInitialMs),
                Duration.ofMillis(backoffMaxMs),
                Duration.ofMillis(startupGraceMs)
        );
    }

    record RelaySettingsFile(
            Long callDeadlineMs,
            Long startupGraceMs,
            Long backoffInitialMs,
            Long backoffMaxMs,
            Integer maxFrameBytes,
            String orderingMode,
            Long orderSeed
    ) {
    }
}
