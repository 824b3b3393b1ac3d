package com.kcache.agent.persist;

import com.kcache.agent.table.AggregationTable;
import com.kcache.agent.table.EntryStats;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Saves the aggregation table on orderly shutdown and restores it at startup.
 *
 * The file is written to a temporary path and renamed over the canonical one, so an interrupted
 * save leaves the previous file intact. The canonical file is removed after every load attempt:
 * each run starts from exactly one generation of data.
 *
 * No I/O failure escapes this class; every one is reported on stderr.
 */
public class PersistenceManager {

    public static final String FILE_NAME = "kcache.stat";
    static final String TMP_SUFFIX = ".tmp";

    private final Path file;
    private final Path tmpFile;

    public PersistenceManager(Path directory) {
        this.file = directory.resolve(FILE_NAME);
        this.tmpFile = directory.resolve(FILE_NAME + TMP_SUFFIX);
    }

    public Path file() {
        return file;
    }

    /**
     * Loads the saved file into {@code table}, which must not yet accept observations.
     * On a bad header or read error the table is emptied.
     *
     * Records without calls are skipped: a restored entry is always a measured one.
     *
     * @return number of records the table accepted
     */
    public int load(AggregationTable table) {
        if (!Files.exists(file)) {
            return 0;
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(Files.readAllBytes(file));
            int[] restored = new int[1];
            int[] skipped = new int[1];
            int count = SnapshotCodec.decode(buf, row -> {
                if (row.counters().calls() <= 0) {
                    skipped[0]++;
                } else if (table.restore(row.identity(), row.counters())) {
                    restored[0]++;
                }
            });
            if (skipped[0] > 0) {
                System.err.println("[kcache-agent] WARNING: skipped " + skipped[0]
                    + " records without calls in " + file);
            }
            System.err.println("[kcache-agent] restored " + restored[0] + " of " + count + " records from "
                + file + ", " + table.size() + " entries live");
            return restored[0];
        } catch (IOException e) {
            System.err.println("[kcache-agent] WARNING: could not read kcache file \"" + file + "\": "
                + e.getMessage());
            table.reset();
            return 0;
        } finally {
            delete(file);
        }
    }

    /**
     * Writes every measured entry of {@code table}. Only call on an orderly shutdown.
     *
     * @return true if the file was written and renamed into place
     */
    public boolean save(AggregationTable table) {
        List<EntryStats> rows = table.snapshot();
        try {
            Files.createDirectories(tmpFile.getParent() != null ? tmpFile.getParent() : Path.of("."));
            try (FileChannel ch = FileChannel.open(tmpFile,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buf = SnapshotCodec.encode(rows);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            Files.move(tmpFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            System.err.println("[kcache-agent] " + rows.size() + " entries written: " + file);
            return true;
        } catch (IOException e) {
            System.err.println("[kcache-agent] WARNING: could not write kcache file \"" + tmpFile + "\": "
                + e.getMessage());
            delete(tmpFile);
            return false;
        }
    }

    /** Removes a stale file without loading it (persistence disabled). */
    public void discard() {
        delete(file);
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("[kcache-agent] WARNING: could not remove \"" + path + "\": " + e.getMessage());
        }
    }
}
