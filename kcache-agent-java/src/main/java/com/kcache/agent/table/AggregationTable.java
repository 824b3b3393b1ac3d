package com.kcache.agent.table;

import com.kcache.agent.sampler.ResourceDelta;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded map from {@link Identity} to accumulated counters.
 *
 * Locking is two-tier:
 * <ul>
 *   <li>a structural read/write lock: shared for lookup, accumulate and snapshot;
 *       exclusive for insert (with a possible eviction pass), restore and reset</li>
 *   <li>a per-entry guard protecting only that entry's counters</li>
 * </ul>
 * An entry guard is never held while the structural lock is being acquired, and a context holds
 * at most one guard at a time.
 *
 * The live entry count never exceeds the capacity fixed at construction.
 */
public final class AggregationTable {

    private final int capacity;
    private final Map<Identity, Entry> entries;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // written under the exclusive lock only
    private double medianUsage = EvictionPolicy.ASSUMED_MEDIAN_INIT;

    public AggregationTable(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new HashMap<>((int) Math.min((long) capacity * 4 / 3 + 1, 1 << 30));
    }

    // -----------------------------------------------------------------------
    // Lookup / insert
    // -----------------------------------------------------------------------

    /**
     * Returns the live entry for {@code identity}, creating a sticky placeholder on a miss.
     * Returns null when no slot could be freed for a new identity.
     */
    public Entry findOrCreate(Identity identity) {
        lock.readLock().lock();
        try {
            Entry e = entries.get(identity);
            if (e != null) return e;
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            return createLocked(identity);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Caller must hold the exclusive lock. */
    private Entry createLocked(Identity identity) {
        // another context may have inserted it between our shared and exclusive acquisitions
        Entry e = entries.get(identity);
        if (e != null) return e;

        if (entries.size() >= capacity) {
            EvictionPolicy.Pass pass = EvictionPolicy.run(entries, medianUsage);
            medianUsage = pass.medianUsage();
        }
        if (entries.size() >= capacity) {
            System.err.println("[kcache-agent] WARNING: no free entry for " + identity
                + ", observation dropped");
            return null;
        }

        e = new Entry(identity, medianUsage);
        entries.put(identity, e);
        return e;
    }

    // -----------------------------------------------------------------------
    // Accumulation
    // -----------------------------------------------------------------------

    /**
     * Adds one observation for {@code identity}, creating the entry on first observation.
     *
     * @return false if the observation was dropped because the table had no room
     */
    public boolean accumulate(Identity identity, ResourceDelta delta) {
        lock.readLock().lock();
        try {
            Entry e = entries.get(identity);
            if (e == null) {
                lock.readLock().unlock();
                lock.writeLock().lock();
                try {
                    e = createLocked(identity);
                } finally {
                    // downgrade: no eviction can run between insert and accumulate
                    lock.readLock().lock();
                    lock.writeLock().unlock();
                }
            }
            if (e == null) return false;
            e.add(delta);
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Adds one observation to a handle obtained from {@link #findOrCreate}.
     * If the entry was evicted or reset in the meantime, the identity is resolved again.
     */
    public boolean accumulate(Entry handle, ResourceDelta delta) {
        lock.readLock().lock();
        try {
            if (handle.isLive()) {
                handle.add(delta);
                return true;
            }
        } finally {
            lock.readLock().unlock();
        }
        return accumulate(handle.identity(), delta);
    }

    /**
     * Inserts a persisted entry as already measured, keeping its stored usage.
     * Goes through normal eviction when the table is full.
     */
    public boolean restore(Identity identity, Counters counters) {
        lock.writeLock().lock();
        try {
            Entry e = createLocked(identity);
            if (e == null) return false;
            e.load(counters);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -----------------------------------------------------------------------
    // Read / reset
    // -----------------------------------------------------------------------

    /**
     * Copies every measured entry. Each copy is consistent on its own; the sequence as a whole
     * is not an atomic view of the table. Sticky placeholders are skipped.
     */
    public List<EntryStats> snapshot() {
        lock.readLock().lock();
        try {
            List<EntryStats> out = new ArrayList<>(entries.size());
            for (Entry e : entries.values()) {
                Counters c = e.copy();
                if (c.isSticky()) continue;
                out.add(new EntryStats(e.identity(), c));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void reset() {
        lock.writeLock().lock();
        try {
            for (Entry e : entries.values()) {
                e.retire();
            }
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /** Median usage recorded by the last eviction pass; the seed for new sticky entries. */
    public double medianUsage() {
        lock.readLock().lock();
        try {
            return medianUsage;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of one entry including sticky ones, or null if absent. */
    public Counters peek(Identity identity) {
        lock.readLock().lock();
        try {
            Entry e = entries.get(identity);
            return e == null ? null : e.copy();
        } finally {
            lock.readLock().unlock();
        }
    }
}
