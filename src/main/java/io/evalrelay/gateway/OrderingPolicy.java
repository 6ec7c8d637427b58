package io.evalrelay.gateway;

import io.evalrelay.model.OrderingMode;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Evaluation order of a run, fixed once at gateway start.
 *
 * <p>{@code RANDOM} draws a fresh seed from {@link SecureRandom} every run and never looks at the
 * committed seed; {@code FIXED_SEEDED} always shuffles with the committed seed, so the private
 * order is reproducible and cannot be recovered from public runs.
 */
public final class OrderingPolicy {
    private final OrderingMode mode;
    private final long seed;

    private OrderingPolicy(OrderingMode mode, long seed) {
        this.mode = mode;
        this.seed = seed;
    }

    public static OrderingPolicy random() {
        return new OrderingPolicy(OrderingMode.RANDOM, new SecureRandom().nextLong());
    }

    public static OrderingPolicy fixed(long committedSeed) {
        return new OrderingPolicy(OrderingMode.FIXED_SEEDED, committedSeed);
    }

    public static OrderingPolicy of(OrderingMode mode, Long committedSeed) {
        if (mode == OrderingMode.FIXED_SEEDED) {
            if (committedSeed == null) {
                throw new IllegalArgumentException("fixed ordering requires a committed seed");
            }
            return fixed(committedSeed);
        }
        return random();
    }

    public OrderingMode mode() {
        return mode;
    }

    public <T> List<T> permute(List<T> items) {
        List<T> copy = new ArrayList<>(items);
        Collections.shuffle(copy, new Random(seed));
        return List.copyOf(copy);
    }
}
