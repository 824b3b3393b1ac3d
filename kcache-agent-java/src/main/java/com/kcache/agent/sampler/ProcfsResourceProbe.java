package com.kcache.agent.sampler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Linux probe reading the calling thread's kernel accounting from procfs.
 *
 * <pre>
 *   stat: utime / stime (fields 14 and 15), in clock ticks of 1 / USER_HZ seconds
 *   io:   read_bytes / write_bytes, storage-layer bytes
 * </pre>
 *
 * Both are scaled at read time: ticks to nanoseconds, bytes to 512-byte blocks.
 * A failed read falls back to the portable probe for that sample.
 */
public class ProcfsResourceProbe implements ResourceProbe {

    public static final Path THREAD_SELF = Paths.get("/proc/thread-self");

    /** Kernel-exported tick rate of utime/stime (sysconf(_SC_CLK_TCK)); fixed at 100 on Linux. */
    static final long USER_HZ = 100;
    static final long NANOS_PER_TICK = 1_000_000_000L / USER_HZ;
    static final long BLOCK_SIZE = 512;

    // field index after the ")" closing the comm field: state is 0, utime is 11, stime is 12
    private static final int UTIME_INDEX = 11;
    private static final int STIME_INDEX = 12;

    private final Path statPath;
    private final Path ioPath;
    private final ResourceProbe fallback;
    private final AtomicBoolean warned = new AtomicBoolean(false);
    // outcome of the most recent read on any thread
    private volatile boolean lastReadOk = true;

    public ProcfsResourceProbe(Path threadDir, ResourceProbe fallback) {
        this.statPath = threadDir.resolve("stat");
        this.ioPath = threadDir.resolve("io");
        this.fallback = fallback;
    }

    @Override
    public RawUsage read() {
        try {
            long[] cpu = parseStat(Files.readString(statPath));
            long[] io = parseIo(Files.readAllLines(ioPath));
            RawUsage usage = new RawUsage(
                cpu[0] * NANOS_PER_TICK,
                cpu[1] * NANOS_PER_TICK,
                io[0] / BLOCK_SIZE,
                io[1] / BLOCK_SIZE,
                true
            );
            lastReadOk = true;
            return usage;
        } catch (IOException | RuntimeException e) {
            lastReadOk = false;
            if (warned.compareAndSet(false, true)) {
                System.err.println("[kcache-agent] WARNING: could not read " + statPath.getParent()
                    + ", falling back to " + fallback.name() + ": " + e.getMessage());
            }
            return fallback.read();
        }
    }

    @Override
    public boolean ioAvailable() {
        return lastReadOk;
    }

    @Override
    public String name() {
        return "procfs";
    }

    /** Returns {utime, stime} in ticks. The comm field may itself contain spaces and parentheses. */
    static long[] parseStat(String stat) {
        int close = stat.lastIndexOf(')');
        if (close < 0) {
            throw new IllegalArgumentException("malformed stat line");
        }
        String[] fields = stat.substring(close + 1).trim().split("\\s+");
        if (fields.length <= STIME_INDEX) {
            throw new IllegalArgumentException("stat line has " + fields.length + " fields after comm");
        }
        return new long[]{ Long.parseLong(fields[UTIME_INDEX]), Long.parseLong(fields[STIME_INDEX]) };
    }

    /** Returns {read_bytes, write_bytes}. */
    static long[] parseIo(List<String> lines) {
        long read = -1;
        long write = -1;
        for (String line : lines) {
            String[] kv = line.split(":", 2);
            if (kv.length != 2) continue;
            switch (kv[0].trim()) {
                case "read_bytes"  -> read  = Long.parseLong(kv[1].trim());
                case "write_bytes" -> write = Long.parseLong(kv[1].trim());
                default -> { }
            }
        }
        if (read < 0 || write < 0) {
            throw new IllegalArgumentException("io file lacks read_bytes/write_bytes");
        }
        return new long[]{ read, write };
    }
}
