package com.kcache.agent.sampler;

/**
 * Raw resource counters of the current thread, already scaled to nanoseconds and 512-byte blocks.
 * Block counters are zero when {@code ioAvailable} is false.
 */
public record RawUsage(
    long userNanos,
    long systemNanos,
    long readBlocks,
    long writeBlocks,
    boolean ioAvailable
) {}
