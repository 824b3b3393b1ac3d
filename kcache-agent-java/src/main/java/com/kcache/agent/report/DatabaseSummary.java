package com.kcache.agent.report;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-database totals over all principals and operations.
 * Block counters stay null if any contributing row lacked them.
 */
public record DatabaseSummary(
    long databaseId,
    long calls,
    Long reads,
    Long writes,
    double userTime,
    double systemTime
) {

    /** Groups {@code rows} by database id, ordered by id. */
    public static List<DatabaseSummary> summarize(List<OperationStats> rows) {
        Map<Long, DatabaseSummary> byDb = new LinkedHashMap<>();
        for (OperationStats row : rows) {
            long db = row.identity().databaseIdUnsigned();
            DatabaseSummary one = new DatabaseSummary(
                db, row.calls(), row.reads(), row.writes(), row.userTime(), row.systemTime());
            byDb.merge(db, one, DatabaseSummary::plus);
        }
        List<DatabaseSummary> out = new ArrayList<>(byDb.values());
        out.sort(Comparator.comparingLong(DatabaseSummary::databaseId));
        return out;
    }

    private DatabaseSummary plus(DatabaseSummary o) {
        return new DatabaseSummary(
            databaseId,
            calls + o.calls,
            reads == null || o.reads == null ? null : reads + o.reads,
            writes == null || o.writes == null ? null : writes + o.writes,
            userTime + o.userTime,
            systemTime + o.systemTime
        );
    }
}
