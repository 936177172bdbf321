package com.codev.common.infra;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Reconnect backoff computation with jitter and a flat cooldown.
 * <p>
 * Delay grows as {@code 1000 * 2^attempt} plus up to one second of jitter, capped at
 * one minute. From the tenth consecutive failure on, the delay is a flat five minutes.
 */
public final class Backoff {

    private Backoff() {
    }

    /** Base delay for attempt zero. */
    public static final long BASE_DELAY_MS = 1_000;

    /** Upper bound (exclusive) of the random jitter added to each delay. */
    public static final long MAX_JITTER_MS = 1_000;

    /** Cap applied after jitter is added. */
    public static final long MAX_DELAY_MS = 60_000;

    /** Number of consecutive failures that engages the cooldown. */
    public static final int COOLDOWN_THRESHOLD = 10;

    /** Flat delay once the cooldown is engaged. */
    public static final long COOLDOWN_DELAY_MS = 300_000;

    /**
     * Compute the reconnect delay using {@link ThreadLocalRandom} for jitter.
     *
     * @param attempt number of consecutive failures so far
     * @return delay in milliseconds
     */
    public static long calculateBackoff(int attempt) {
        return calculateBackoff(attempt, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Compute the reconnect delay.
     *
     * @param attempt number of consecutive failures so far; negative values count as zero
     * @param random  source of uniform values in {@code [0, 1)}
     * @return delay in milliseconds
     */
    public static long calculateBackoff(int attempt, DoubleSupplier random) {
        if (attempt >= COOLDOWN_THRESHOLD) {
            return COOLDOWN_DELAY_MS;
        }
        long base = BASE_DELAY_MS << Math.max(attempt, 0);
        long jitter = (long) Math.floor(random.getAsDouble() * MAX_JITTER_MS);
        return Math.min(base + jitter, MAX_DELAY_MS);
    }
}
