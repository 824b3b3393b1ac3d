package com.kcache.agent;

/** Which nesting levels of monitored operations are recorded. */
public enum TrackLevel {
    /** Nothing is recorded. */
    NONE,
    /** Only the outermost monitored operation of each thread. */
    TOP,
    /** Every nesting level. */
    ALL;

    boolean records(int depth) {
        return switch (this) {
            case NONE -> false;
            case TOP  -> depth == 0;
            case ALL  -> true;
        };
    }

    /** Parses "none" / "top" / "all" case-insensitively; returns null for anything else. */
    static TrackLevel parse(String value) {
        if (value == null) return null;
        return switch (value.trim().toLowerCase()) {
            case "none" -> NONE;
            case "top"  -> TOP;
            case "all"  -> ALL;
            default -> null;
        };
    }
}
