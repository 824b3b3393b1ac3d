package com.kcache.agent.table;

/**
 * Immutable copy of an entry's counters.
 * reads/writes are in 512-byte blocks, times in seconds. They carry no information unless
 * {@code ioMeasured} is set, i.e. at least one observation came with block I/O accounting.
 */
public record Counters(
    long calls,
    long reads,
    long writes,
    double userTime,
    double systemTime,
    double usage,
    boolean ioMeasured
) {

    public Counters(long calls, long reads, long writes, double userTime, double systemTime, double usage) {
        this(calls, reads, writes, userTime, systemTime, usage, true);
    }

    /** True for a reserved placeholder that has never been measured. */
    public boolean isSticky() {
        return calls == 0;
    }
}
