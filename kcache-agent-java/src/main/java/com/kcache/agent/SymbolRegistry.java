package com.kcache.agent;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps method symbols to 64-bit operation ids (FNV-1a of the UTF-8 symbol) and back.
 * The reverse map only knows symbols seen in this run.
 */
public final class SymbolRegistry {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final ConcurrentHashMap<String, Long> ids = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, String> names = new ConcurrentHashMap<>();

    public long register(String symbol) {
        Long id = ids.get(symbol);
        if (id != null) return id;
        long computed = operationId(symbol);
        ids.putIfAbsent(symbol, computed);
        names.putIfAbsent(computed, symbol);
        return computed;
    }

    /** Returns the symbol for {@code operationId}, or null if it was not seen in this run. */
    public String nameOf(long operationId) {
        return names.get(operationId);
    }

    static long operationId(String symbol) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : symbol.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
