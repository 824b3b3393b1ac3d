package com.kcache.agent.sampler;

/** Counters captured at the start of one monitored operation. Owned by a single thread. */
public record ResourceSnapshot(RawUsage usage, long wallNanos) {}
