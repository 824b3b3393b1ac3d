package com.kcache.agent.table;

import com.kcache.agent.sampler.ResourceDelta;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One live bucket of the aggregation table.
 *
 * Counter fields are guarded by {@code guard}; the guard is only ever held for a few
 * field writes and never while acquiring the table's structural lock.
 * {@code live} is cleared under the exclusive structural lock when the entry is evicted or reset.
 */
public final class Entry {

    private final Identity identity;
    private final ReentrantLock guard = new ReentrantLock();

    private long calls;
    private long reads;
    private long writes;
    private double userTime;
    private double systemTime;
    private double usage;
    private boolean ioMeasured;

    private volatile boolean live = true;

    Entry(Identity identity, double initialUsage) {
        this.identity = identity;
        this.usage = initialUsage;
    }

    public Identity identity() {
        return identity;
    }

    public boolean isLive() {
        return live;
    }

    void retire() {
        live = false;
    }

    /** Adds one observation. A sticky entry is promoted to the measured usage baseline. */
    void add(ResourceDelta delta) {
        guard.lock();
        try {
            if (calls == 0) {
                usage = EvictionPolicy.USAGE_INIT;
            }
            calls++;
            if (delta.ioAvailable()) {
                reads += delta.reads();
                writes += delta.writes();
                ioMeasured = true;
            }
            userTime += delta.userTime();
            systemTime += delta.systemTime();
        } finally {
            guard.unlock();
        }
    }

    /** Overwrites all counters; used when restoring a persisted entry. */
    void load(Counters c) {
        guard.lock();
        try {
            calls = c.calls();
            reads = c.reads();
            writes = c.writes();
            userTime = c.userTime();
            systemTime = c.systemTime();
            usage = c.usage();
            ioMeasured = c.ioMeasured();
        } finally {
            guard.unlock();
        }
    }

    /** Multiplies usage by the decay factor matching this entry's state and returns the new usage. */
    double decay() {
        guard.lock();
        try {
            usage *= calls == 0 ? EvictionPolicy.STICKY_DECREASE_FACTOR : EvictionPolicy.USAGE_DECREASE_FACTOR;
            return usage;
        } finally {
            guard.unlock();
        }
    }

    public Counters copy() {
        guard.lock();
        try {
            return new Counters(calls, reads, writes, userTime, systemTime, usage, ioMeasured);
        } finally {
            guard.unlock();
        }
    }
}
