package com.phillippitts.erasemark.util;

import java.time.Duration;

/**
 * Elapsed-time and deadline helpers built on {@link System#nanoTime()}.
 *
 * <p>Deadlines are plain nanoTime values so they can be compared without
 * wall-clock drift, which matters for the cloud polling budget.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Computes a nanoTime deadline {@code budget} from now.
     *
     * @param budget time budget (negative values are treated as zero)
     * @return deadline in {@link System#nanoTime()} units
     */
    public static long deadlineAfter(Duration budget) {
        long nanos = budget.isNegative() ? 0L : budget.toNanos();
        return System.nanoTime() + nanos;
    }

    /**
     * Milliseconds left until a deadline from {@link #deadlineAfter(Duration)}.
     *
     * @return remaining milliseconds, never negative
     */
    public static long remainingMillis(long deadlineNanos) {
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? 0L : left / NANOS_PER_MILLI;
    }
}
