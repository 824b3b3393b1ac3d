package com.kcache.agent.table;

/**
 * Key of one aggregation bucket.
 *
 * principalId and databaseId are unsigned 32-bit values carried in an int;
 * use {@link #principalIdUnsigned()} / {@link #databaseIdUnsigned()} when printing.
 */
public record Identity(int principalId, int databaseId, long operationId) {

    public long principalIdUnsigned() {
        return Integer.toUnsignedLong(principalId);
    }

    public long databaseIdUnsigned() {
        return Integer.toUnsignedLong(databaseId);
    }
}
