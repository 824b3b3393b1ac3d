package com.kcache.agent.sampler;

import java.util.function.LongSupplier;

/**
 * Brackets a monitored operation and computes the resources it consumed.
 *
 * Short operations are corrected for tick granularity: when the host-measured elapsed time is
 * below three ticks, the CPU counters cannot be trusted, so the elapsed time is recorded as user
 * time and system time as zero.
 */
public class ResourceSampler {

    static final double NANOS_PER_SECOND = 1_000_000_000.0;
    static final int BIAS_TICKS = 3;

    private final ResourceProbe probe;
    private final int hz;
    private final double biasThresholdSeconds;
    private final LongSupplier wallClock;

    public ResourceSampler(ResourceProbe probe, int hz) {
        this(probe, hz, System::nanoTime);
    }

    ResourceSampler(ResourceProbe probe, int hz, LongSupplier wallClock) {
        if (hz <= 0) {
            throw new IllegalArgumentException("tick rate must be positive: " + hz);
        }
        this.probe = probe;
        this.hz = hz;
        this.biasThresholdSeconds = (double) BIAS_TICKS / hz;
        this.wallClock = wallClock;
    }

    public ResourceSnapshot begin() {
        return new ResourceSnapshot(probe.read(), wallClock.getAsLong());
    }

    /** Ends the operation, using the wall time since {@link #begin()} as the elapsed time. */
    public ResourceDelta end(ResourceSnapshot begin) {
        double elapsed = (wallClock.getAsLong() - begin.wallNanos()) / NANOS_PER_SECOND;
        return end(begin, elapsed);
    }

    /**
     * Ends the operation.
     *
     * @param elapsedSeconds the host's own measurement of the operation's duration
     */
    public ResourceDelta end(ResourceSnapshot begin, double elapsedSeconds) {
        RawUsage now = probe.read();
        RawUsage then = begin.usage();

        double userTime = Math.max(0, now.userNanos() - then.userNanos()) / NANOS_PER_SECOND;
        double systemTime = Math.max(0, now.systemNanos() - then.systemNanos()) / NANOS_PER_SECOND;

        boolean io = now.ioAvailable() && then.ioAvailable();
        long reads = io ? Math.max(0, now.readBlocks() - then.readBlocks()) : 0;
        long writes = io ? Math.max(0, now.writeBlocks() - then.writeBlocks()) : 0;

        if (elapsedSeconds >= 0 && elapsedSeconds < biasThresholdSeconds) {
            userTime = elapsedSeconds;
            systemTime = 0.0;
        }
        return new ResourceDelta(reads, writes, userTime, systemTime, io);
    }

    public boolean ioAvailable() {
        return probe.ioAvailable();
    }

    public int hz() {
        return hz;
    }

    public String probeName() {
        return probe.name();
    }
}
