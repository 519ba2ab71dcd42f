package com.phillippitts.clinicalai.util;

/**
 * Monotonic timing helpers built on {@link System#nanoTime()}.
 *
 * <p>Typical usage:
 * <pre>
 * long start = System.nanoTime();
 * GenerationResult r = backend.generate(request);
 * long ms = TimeUtils.elapsedMillis(start);
 * </pre>
 *
 * @since 1.0
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos, never negative
     */
    public static long elapsedMillis(long startNanos) {
        return Math.max(0L, (System.nanoTime() - startNanos) / NANOS_PER_MILLI);
    }

    /**
     * Milliseconds left until a deadline computed as {@code start + budgetMs}.
     *
     * @return remaining milliseconds, or 0 when the deadline has passed
     */
    public static long remainingMillis(long startNanos, long budgetMs) {
        return Math.max(0L, budgetMs - elapsedMillis(startNanos));
    }
}
