package com.kcache.agent.report;

import com.kcache.agent.table.Identity;

/**
 * One row handed to the report layer.
 * {@code reads} and {@code writes} are null, not zero, where block I/O accounting is unavailable.
 */
public record OperationStats(
    Identity identity,
    long calls,
    Long reads,
    Long writes,
    double userTime,
    double systemTime
) {}
