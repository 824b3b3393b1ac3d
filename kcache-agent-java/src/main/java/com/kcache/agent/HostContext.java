package com.kcache.agent;

import com.kcache.agent.table.Identity;

/**
 * Principal and database the current thread works for.
 *
 * The host application binds these before running monitored operations (for example when a
 * request is dispatched) and clears them afterwards. Unbound threads report 0 / 0.
 */
public final class HostContext {

    private HostContext() {}

    record Binding(int principalId, int databaseId) {}

    private static final Binding UNBOUND = new Binding(0, 0);

    private static final ThreadLocal<Binding> current = ThreadLocal.withInitial(() -> UNBOUND);

    public static void bind(int principalId, int databaseId) {
        current.set(new Binding(principalId, databaseId));
    }

    public static void clear() {
        current.remove();
    }

    public static Identity identityFor(long operationId) {
        Binding b = current.get();
        return new Identity(b.principalId(), b.databaseId(), operationId);
    }
}
