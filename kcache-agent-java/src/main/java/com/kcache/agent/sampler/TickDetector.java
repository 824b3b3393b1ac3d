package com.kcache.agent.sampler;

import java.util.function.LongSupplier;

/**
 * Measures the platform's CPU accounting tick.
 *
 * Busy-waits until the tick-granular user-time counter changes once (to align on a tick
 * boundary), then measures the wall time until it changes again and inverts it.
 */
public final class TickDetector {

    public static final int DEFAULT_HZ = 100;
    static final long TIMEOUT_NANOS = 1_000_000_000L;

    private TickDetector() {}

    /** Detects the tick rate of {@code probe} on the calling thread, or {@link #DEFAULT_HZ} on timeout. */
    public static int detectHz(ResourceProbe probe) {
        int hz = detectHz(() -> probe.read().userNanos(), System::nanoTime, TIMEOUT_NANOS);
        if (hz <= 0) {
            System.err.println("[kcache-agent] WARNING: user time did not advance within "
                + TIMEOUT_NANOS / 1_000_000 + " ms, assuming " + DEFAULT_HZ + " Hz");
            return DEFAULT_HZ;
        }
        System.err.println("[kcache-agent] detected tick rate: " + hz + " Hz");
        return hz;
    }

    /**
     * @return the tick rate in Hz, or -1 if the user-time counter did not change twice
     *         within {@code timeoutNanos}
     */
    static int detectHz(LongSupplier userTime, LongSupplier wallClock, long timeoutNanos) {
        long deadline = wallClock.getAsLong() + timeoutNanos;

        long boundary = waitForChange(userTime, wallClock, userTime.getAsLong(), deadline);
        if (boundary == Long.MIN_VALUE) return -1;
        long tickStart = wallClock.getAsLong();

        if (waitForChange(userTime, wallClock, boundary, deadline) == Long.MIN_VALUE) return -1;
        long elapsed = wallClock.getAsLong() - tickStart;

        if (elapsed <= 0) return -1;
        return (int) Math.round(1_000_000_000.0 / elapsed);
    }

    /** Spins until userTime differs from {@code from}; returns the new value or Long.MIN_VALUE on timeout. */
    private static long waitForChange(LongSupplier userTime, LongSupplier wallClock, long from, long deadline) {
        long now;
        while ((now = userTime.getAsLong()) == from) {
            if (wallClock.getAsLong() - deadline > 0) {
                return Long.MIN_VALUE;
            }
        }
        return now;
    }
}
