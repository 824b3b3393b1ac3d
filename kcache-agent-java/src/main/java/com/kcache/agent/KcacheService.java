package com.kcache.agent;

import com.kcache.agent.persist.PersistenceManager;
import com.kcache.agent.report.DatabaseSummary;
import com.kcache.agent.report.OperationStats;
import com.kcache.agent.report.ResultSink;
import com.kcache.agent.sampler.ResourceDelta;
import com.kcache.agent.sampler.ResourceSampler;
import com.kcache.agent.sampler.ResourceSnapshot;
import com.kcache.agent.table.AggregationTable;
import com.kcache.agent.table.Counters;
import com.kcache.agent.table.EntryStats;
import com.kcache.agent.table.Identity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-identity resource statistics for one process.
 *
 * Lifecycle: {@link #init(Integer)} allocates the table and restores the previous run's file,
 * {@link #shutdown(boolean)} saves it. Observations arriving before init completes are dropped.
 *
 * Each thread keeps its own stack of pending samples, so nested and concurrent operations never
 * share a snapshot.
 */
public class KcacheService {

    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) { super(message); }
    }

    public static class NotInitializedException extends IllegalStateException {
        public NotInitializedException(String message) { super(message); }
    }

    public static class InsufficientPrivilegeException extends RuntimeException {
        public InsufficientPrivilegeException(String message) { super(message); }
    }

    // pushed for operations whose nesting level is not tracked, to keep the stack balanced
    private static final ResourceSnapshot UNTRACKED = new ResourceSnapshot(null, 0);

    private final ResourceSampler sampler;
    private final TrackLevel track;
    private final PersistenceManager persistence;
    private final boolean persist;

    private final ThreadLocal<Deque<ResourceSnapshot>> pending =
        ThreadLocal.withInitial(ArrayDeque::new);

    private volatile AggregationTable table;
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    /**
     * @param persistence file store, or null for a purely in-memory service
     * @param persist     when false an existing file is discarded at init and nothing is saved
     */
    public KcacheService(ResourceSampler sampler, TrackLevel track, PersistenceManager persistence, boolean persist) {
        this.sampler = sampler;
        this.track = track;
        this.persistence = persistence;
        this.persist = persist;
    }

    // -----------------------------------------------------------------------
    // Lifecycle
    // -----------------------------------------------------------------------

    /**
     * Allocates the table with the host's capacity hint and restores saved statistics.
     *
     * @throws ConfigurationException if the hint is missing or not positive, or if already initialized
     */
    public synchronized void init(Integer capacityHint) {
        if (table != null) {
            throw new ConfigurationException("kcache already initialized with capacity "
                + table.capacity() + "; a restart is required to resize it");
        }
        if (capacityHint == null) {
            throw new ConfigurationException("kcache capacity is not available; load kcache-agent with "
                + "-javaagent at JVM startup so that 'max' is read before the first monitored operation");
        }
        if (capacityHint < 1) {
            throw new ConfigurationException("kcache capacity must be positive, got " + capacityHint
                + "; set agent argument max=<n> with n >= 1");
        }

        AggregationTable t = new AggregationTable(capacityHint);
        if (persistence != null) {
            if (persist) {
                persistence.load(t);
            } else {
                persistence.discard();
            }
        }
        table = t;
        System.err.println("[kcache-agent] initialized: capacity=" + capacityHint + " track=" + track
            + " probe=" + sampler.probeName() + " io=" + sampler.ioAvailable() + " hz=" + sampler.hz());
    }

    /**
     * Saves statistics on an orderly shutdown. A crashing shutdown ({@code orderly == false})
     * never touches the file. Runs at most once.
     */
    public void shutdown(boolean orderly) {
        AggregationTable t = table;
        if (t == null || !shutDown.compareAndSet(false, true)) {
            return;
        }
        if (orderly && persist && persistence != null) {
            persistence.save(t);
        }
    }

    public boolean isInitialized() {
        return table != null;
    }

    // -----------------------------------------------------------------------
    // Host hooks
    // -----------------------------------------------------------------------

    /** Called immediately before a monitored operation starts on the current thread. */
    public void onOperationStart() {
        Deque<ResourceSnapshot> stack = pending.get();
        stack.push(track.records(stack.size()) ? sampler.begin() : UNTRACKED);
    }

    /** Called after the operation completed; the elapsed time is taken from the start sample. */
    public void onOperationEnd(Identity identity) {
        ResourceSnapshot begin = pop();
        if (begin == null) return;
        record(identity, sampler.end(begin));
    }

    /**
     * Called after the operation completed.
     *
     * @param elapsedSeconds the host's own measurement of the operation's duration
     */
    public void onOperationEnd(Identity identity, double elapsedSeconds) {
        onOperationEnd(identity, elapsedSeconds, List.of());
    }

    /**
     * Called after an operation that helper threads cooperated on. Their deltas are merged into
     * this thread's delta so the operation is counted once.
     */
    public void onOperationEnd(Identity identity, double elapsedSeconds, List<ResourceDelta> helperDeltas) {
        ResourceSnapshot begin = pop();
        if (begin == null) return;
        ResourceDelta delta = sampler.end(begin, elapsedSeconds);
        for (ResourceDelta helper : helperDeltas) {
            delta = delta.plus(helper);
        }
        record(identity, delta);
    }

    /** Called when the operation failed; its sample is discarded and nothing is recorded. */
    public void onOperationAbort() {
        pop();
    }

    /** Returns the pending tracked sample, or null if the level is untracked or nothing is pending. */
    private ResourceSnapshot pop() {
        Deque<ResourceSnapshot> stack = pending.get();
        if (stack.isEmpty()) return null;
        ResourceSnapshot s = stack.pop();
        return s == UNTRACKED ? null : s;
    }

    private void record(Identity identity, ResourceDelta delta) {
        AggregationTable t = table;
        if (t == null) return;
        t.accumulate(identity, delta);
    }

    /** Number of samples pending on the current thread. */
    int pendingDepth() {
        return pending.get().size();
    }

    // -----------------------------------------------------------------------
    // Control API
    // -----------------------------------------------------------------------

    /**
     * Removes all statistics.
     *
     * @throws NotInitializedException        before {@link #init(Integer)} completed
     * @throws InsufficientPrivilegeException unless the caller is elevated
     */
    public void resetAll(CallerPrivilege privilege) {
        AggregationTable t = requireTable();
        if (privilege != CallerPrivilege.ELEVATED) {
            throw new InsufficientPrivilegeException("permission denied: resetting kcache statistics requires "
                + CallerPrivilege.ELEVATED + " privilege");
        }
        t.reset();
    }

    /**
     * Copies every measured entry. Block counters are null for an entry none of whose observations
     * had block I/O accounting.
     *
     * @throws NotInitializedException before {@link #init(Integer)} completed
     */
    public List<OperationStats> enumerate() {
        AggregationTable t = requireTable();
        List<EntryStats> snapshot = t.snapshot();
        List<OperationStats> rows = new ArrayList<>(snapshot.size());
        for (EntryStats e : snapshot) {
            Counters c = e.counters();
            boolean io = c.ioMeasured();
            rows.add(new OperationStats(
                e.identity(),
                c.calls(),
                io ? c.reads() : null,
                io ? c.writes() : null,
                c.userTime(),
                c.systemTime()
            ));
        }
        return rows;
    }

    /** Hands every row of {@link #enumerate()} to the host's sink. */
    public void enumerate(ResultSink sink) {
        for (OperationStats row : enumerate()) {
            sink.accept(row);
        }
    }

    public List<DatabaseSummary> summarizeByDatabase() {
        return DatabaseSummary.summarize(enumerate());
    }

    /**
     * Reserves a sticky placeholder for an identity ahead of its first measurement.
     *
     * @return false if the table had no room
     */
    public boolean reserve(Identity identity) {
        return requireTable().findOrCreate(identity) != null;
    }

    AggregationTable table() {
        return table;
    }

    private AggregationTable requireTable() {
        AggregationTable t = table;
        if (t == null) {
            throw new NotInitializedException("kcache is not initialized; load kcache-agent with -javaagent "
                + "at JVM startup");
        }
        return t;
    }
}
