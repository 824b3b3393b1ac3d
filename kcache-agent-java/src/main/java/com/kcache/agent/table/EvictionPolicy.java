package com.kcache.agent.table;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Usage-based eviction for the aggregation table.
 *
 * A pass decays every entry's usage (sticky entries faster), records the median usage so new
 * placeholders can be seeded with it, and removes the lowest-usage entries. The number removed is
 * max(10, 5% of live entries), capped at half the live entries so that no entry above the pass
 * median is removed, and never less than one so the pending insert finds room.
 *
 * Must only be invoked while holding the table's exclusive structural lock.
 */
final class EvictionPolicy {

    static final double USAGE_INIT = 1.0;
    static final double ASSUMED_MEDIAN_INIT = 10.0;
    static final double USAGE_DECREASE_FACTOR = 0.99;
    static final double STICKY_DECREASE_FACTOR = 0.50;
    static final int USAGE_DEALLOC_PERCENT = 5;
    static final int MIN_DEALLOC = 10;

    private EvictionPolicy() {}

    /** Outcome of one pass. */
    record Pass(double medianUsage, List<Identity> evicted) {}

    private record Ranked(Entry entry, double usage) {}

    static Pass run(Map<Identity, Entry> entries, double previousMedian) {
        int live = entries.size();
        if (live == 0) {
            return new Pass(previousMedian, List.of());
        }

        List<Ranked> ranked = new ArrayList<>(live);
        for (Entry e : entries.values()) {
            ranked.add(new Ranked(e, e.decay()));
        }
        // List.sort is stable: ties keep iteration order
        ranked.sort(Comparator.comparingDouble(Ranked::usage));

        double median = ranked.get(live / 2).usage();

        int toEvict = evictionCount(live);
        List<Identity> evicted = new ArrayList<>(toEvict);
        for (int i = 0; i < toEvict; i++) {
            Entry victim = ranked.get(i).entry();
            victim.retire();
            entries.remove(victim.identity());
            evicted.add(victim.identity());
        }
        return new Pass(median, evicted);
    }

    static int evictionCount(int live) {
        int n = Math.max(MIN_DEALLOC, live * USAGE_DEALLOC_PERCENT / 100);
        n = Math.min(n, live / 2);
        return Math.min(Math.max(n, 1), live);
    }
}
