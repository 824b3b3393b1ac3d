package com.kcache.agent.table;

/** Point-in-time copy of one live entry, as returned by {@link AggregationTable#snapshot()}. */
public record EntryStats(Identity identity, Counters counters) {}
