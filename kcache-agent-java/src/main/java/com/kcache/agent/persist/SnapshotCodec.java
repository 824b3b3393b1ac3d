package com.kcache.agent.persist;

import com.kcache.agent.table.Counters;
import com.kcache.agent.table.EntryStats;
import com.kcache.agent.table.Identity;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fixed-layout binary codec of the statistics file. All values little-endian.
 *
 * <pre>
 * file   := magic:u32, count:i32, record x count
 * record := principal_id:u32, db_id:u32, operation_id:u64,
 *           calls:i64, reads:i64, writes:i64,
 *           user_time:f64, system_time:f64, usage:f64
 * </pre>
 *
 * reads and writes are stored as -1 for an entry that never had block I/O accounting.
 */
public final class SnapshotCodec {

    /** Format-version magic; files carrying any other value are discarded. */
    public static final int FILE_HEADER = 0x0d756e0f;

    static final int HEADER_BYTES = 4 + 4;
    static final int RECORD_BYTES = 4 + 4 + 8 + 8 + 8 + 8 + 8 + 8 + 8;
    static final long IO_UNMEASURED = -1;

    private SnapshotCodec() {}

    public static ByteBuffer encode(List<EntryStats> rows) {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_BYTES + RECORD_BYTES * rows.size())
            .order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(FILE_HEADER);
        buf.putInt(rows.size());
        for (EntryStats row : rows) {
            Identity id = row.identity();
            Counters c = row.counters();
            buf.putInt(id.principalId());
            buf.putInt(id.databaseId());
            buf.putLong(id.operationId());
            buf.putLong(c.calls());
            buf.putLong(c.ioMeasured() ? c.reads() : IO_UNMEASURED);
            buf.putLong(c.ioMeasured() ? c.writes() : IO_UNMEASURED);
            buf.putDouble(c.userTime());
            buf.putDouble(c.systemTime());
            buf.putDouble(c.usage());
        }
        buf.flip();
        return buf;
    }

    /**
     * Decodes {@code buf}, handing each record to {@code sink} as soon as it is read.
     * Records handed over before a failure are not retracted; the caller decides what to discard.
     *
     * @return the number of records decoded
     * @throws IOException on a bad header, a negative count or a truncated file
     */
    public static int decode(ByteBuffer buf, Consumer<EntryStats> sink) throws IOException {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        if (buf.remaining() < HEADER_BYTES) {
            throw new EOFException("file shorter than its " + HEADER_BYTES + "-byte header");
        }
        int magic = buf.getInt();
        if (magic != FILE_HEADER) {
            throw new IOException(String.format("bad file header 0x%08x, expected 0x%08x", magic, FILE_HEADER));
        }
        int count = buf.getInt();
        if (count < 0) {
            throw new IOException("negative entry count " + count);
        }
        for (int i = 0; i < count; i++) {
            if (buf.remaining() < RECORD_BYTES) {
                throw new EOFException("truncated at record " + i + " of " + count);
            }
            Identity id = new Identity(buf.getInt(), buf.getInt(), buf.getLong());
            long calls = buf.getLong();
            long reads = buf.getLong();
            long writes = buf.getLong();
            boolean io = reads >= 0 && writes >= 0;
            Counters c = new Counters(
                calls,
                io ? reads : 0,
                io ? writes : 0,
                buf.getDouble(),
                buf.getDouble(),
                buf.getDouble(),
                io
            );
            sink.accept(new EntryStats(id, c));
        }
        return count;
    }
}
