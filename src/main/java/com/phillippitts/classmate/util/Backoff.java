package com.phillippitts.classmate.util;

import java.time.Duration;

/**
 * Bounded exponential backoff: {@code base * 2^attempt}, capped at {@code max}.
 *
 * <p>Attempts are zero-based: attempt 0 waits {@code base}. Used for transcription
 * reconnects, model call retries and persistence retries.
 *
 * @param base        delay before the first retry
 * @param max         upper bound for any single delay
 * @param maxAttempts number of attempts allowed before giving up
 */
public record Backoff(Duration base, Duration max, int maxAttempts) {

    public Backoff {
        if (base == null || base.isNegative()) {
            throw new IllegalArgumentException("base must be >= 0");
        }
        if (max == null || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max must be >= base");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
    }

    public static Backoff ofMillis(long baseMs, long maxMs, int maxAttempts) {
        return new Backoff(Duration.ofMillis(baseMs), Duration.ofMillis(maxMs), maxAttempts);
    }

    /**
     * Delay to wait before retrying after the given zero-based attempt failed.
     */
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return base;
        }
        // Shift bounded to avoid overflow on long outages
        long factor = 1L << Math.min(attempt, 20);
        long millis = base.toMillis() * factor;
        if (millis < 0 || millis > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(millis);
    }

    /**
     * Whether another attempt is allowed after {@code attemptsMade} attempts.
     */
    public boolean allowsAnother(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Sleeps for the delay of the given attempt, restoring the interrupt flag if interrupted.
     *
     * @return false if the thread was interrupted while sleeping
     */
    public boolean sleep(int attempt) {
        try {
            Thread.sleep(delayFor(attempt).toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
