package com.kcache.agent.sampler;

/**
 * Source of the host's raw per-thread resource counters.
 * Implementations must never throw from {@link #read()}.
 */
public interface ResourceProbe {

    /** Reads the calling thread's counters. */
    RawUsage read();

    /** False on platforms without native block I/O accounting. */
    boolean ioAvailable();

    String name();
}
