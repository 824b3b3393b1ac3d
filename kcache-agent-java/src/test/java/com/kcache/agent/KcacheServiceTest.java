package com.kcache.agent;

import com.kcache.agent.persist.PersistenceManager;
import com.kcache.agent.report.DatabaseSummary;
import com.kcache.agent.report.OperationStats;
import com.kcache.agent.sampler.FakeResourceProbe;
import com.kcache.agent.sampler.ProcfsResourceProbe;
import com.kcache.agent.sampler.ResourceDelta;
import com.kcache.agent.sampler.ResourceSampler;
import com.kcache.agent.table.Identity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class KcacheServiceTest {

    private static final long MS = 1_000_000L;
    private static final Identity OUTER = new Identity(10, 1, 100L);
    private static final Identity INNER = new Identity(10, 1, 200L);

    private final FakeResourceProbe probe = new FakeResourceProbe(true);

    private KcacheService service(TrackLevel track) {
        return new KcacheService(new ResourceSampler(probe, 100), track, null, false);
    }

    private KcacheService started(TrackLevel track) {
        KcacheService s = service(track);
        s.init(100);
        return s;
    }

    // --- Lifecycle / errors ---

    @Test
    void controlApiBeforeInitIsNotInitialized() {
        KcacheService s = service(TrackLevel.TOP);
        assertFalse(s.isInitialized());
        assertThrows(KcacheService.NotInitializedException.class, s::enumerate);
        assertThrows(KcacheService.NotInitializedException.class, () -> s.resetAll(CallerPrivilege.ELEVATED));
        assertThrows(KcacheService.NotInitializedException.class, () -> s.reserve(OUTER));
    }

    @Test
    void missingCapacityIsAConfigurationError() {
        KcacheService s = service(TrackLevel.TOP);
        KcacheService.ConfigurationException e =
            assertThrows(KcacheService.ConfigurationException.class, () -> s.init(null));
        assertTrue(e.getMessage().contains("-javaagent"));
        assertThrows(KcacheService.ConfigurationException.class, () -> s.init(0));
        assertFalse(s.isInitialized());
    }

    @Test
    void capacityCannotChangeWithoutRestart() {
        KcacheService s = started(TrackLevel.TOP);
        assertThrows(KcacheService.ConfigurationException.class, () -> s.init(200));
        assertEquals(100, s.table().capacity());
    }

    @Test
    void resetAllRequiresElevatedPrivilege() {
        KcacheService s = started(TrackLevel.TOP);
        s.onOperationStart();
        s.onOperationEnd(OUTER, 1.0);

        assertThrows(KcacheService.InsufficientPrivilegeException.class,
            () -> s.resetAll(CallerPrivilege.ORDINARY));
        assertEquals(1, s.enumerate().size());

        s.resetAll(CallerPrivilege.ELEVATED);
        assertTrue(s.enumerate().isEmpty());
    }

    // --- Hooks ---

    @Test
    void startEndRecordsTheDelta() {
        KcacheService s = started(TrackLevel.TOP);
        s.onOperationStart();
        probe.advance(300 * MS, 100 * MS, 64, 8);
        s.onOperationEnd(OUTER, 1.0);

        List<OperationStats> rows = s.enumerate();
        assertEquals(1, rows.size());
        OperationStats row = rows.get(0);
        assertEquals(OUTER, row.identity());
        assertEquals(1, row.calls());
        assertEquals(Long.valueOf(64), row.reads());
        assertEquals(Long.valueOf(8), row.writes());
        assertEquals(0.3, row.userTime(), 1e-9);
        assertEquals(0.1, row.systemTime(), 1e-9);
    }

    @Test
    void shortOperationAtHundredHertzUsesElapsedTime() {
        KcacheService s = started(TrackLevel.TOP);
        s.onOperationStart();
        probe.advance(0, 20 * MS, 0, 0);
        s.onOperationEnd(OUTER, 0.01);

        OperationStats row = s.enumerate().get(0);
        assertEquals(0.01, row.userTime(), 1e-9);
        assertEquals(0.0, row.systemTime());
    }

    @Test
    void unavailableIoIsNullNotZero() {
        FakeResourceProbe noIo = new FakeResourceProbe(false);
        KcacheService s = new KcacheService(new ResourceSampler(noIo, 100), TrackLevel.TOP, null, false);
        s.init(10);
        s.onOperationStart();
        noIo.advance(50 * MS, 0, 0, 0);
        s.onOperationEnd(OUTER, 1.0);

        OperationStats row = s.enumerate().get(0);
        assertNull(row.reads());
        assertNull(row.writes());
        assertEquals(0.05, row.userTime(), 1e-9);
    }

    @Test
    void operationsAfterProcfsFallbackReportNullBlocks(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("stat"),
            "77 (java) R 1 77 77 0 -1 0 0 0 0 0 120 30 0 0 20 0 1 0 100 0 0");
        Files.write(tmp.resolve("io"), List.of("read_bytes: 4096", "write_bytes: 1024"));
        ProcfsResourceProbe procfs = new ProcfsResourceProbe(tmp, new FakeResourceProbe(false));
        KcacheService s = new KcacheService(new ResourceSampler(procfs, 100), TrackLevel.TOP, null, false);
        s.init(10);

        s.onOperationStart();
        s.onOperationEnd(OUTER, 1.0);

        Files.delete(tmp.resolve("io"));
        s.onOperationStart();
        s.onOperationEnd(INNER, 1.0);

        assertFalse(procfs.ioAvailable());
        for (OperationStats row : s.enumerate()) {
            if (row.identity().equals(OUTER)) {
                assertEquals(Long.valueOf(0), row.reads());
            } else {
                assertNull(row.reads());
                assertNull(row.writes());
            }
        }
        assertNull(s.summarizeByDatabase().get(0).reads());
    }

    @Test
    void trackTopRecordsOnlyOutermostOperation() {
        KcacheService s = started(TrackLevel.TOP);
        s.onOperationStart();
        s.onOperationStart();
        s.onOperationEnd(INNER, 1.0);
        s.onOperationEnd(OUTER, 1.0);

        List<OperationStats> rows = s.enumerate();
        assertEquals(1, rows.size());
        assertEquals(OUTER, rows.get(0).identity());
        assertEquals(0, s.pendingDepth());
    }

    @Test
    void trackAllRecordsEveryLevel() {
        KcacheService s = started(TrackLevel.ALL);
        s.onOperationStart();
        s.onOperationStart();
        probe.advance(0, 0, 4, 0);
        s.onOperationEnd(INNER, 1.0);
        s.onOperationEnd(OUTER, 1.0);

        assertEquals(2, s.enumerate().size());
        assertEquals(Long.valueOf(4), s.enumerate().stream()
            .filter(r -> r.identity().equals(OUTER)).findFirst().orElseThrow().reads());
    }

    @Test
    void trackNoneRecordsNothing() {
        KcacheService s = started(TrackLevel.NONE);
        s.onOperationStart();
        s.onOperationEnd(OUTER, 1.0);
        assertTrue(s.enumerate().isEmpty());
        assertEquals(0, s.pendingDepth());
    }

    @Test
    void abortedOperationRecordsNothing() {
        KcacheService s = started(TrackLevel.TOP);
        s.onOperationStart();
        probe.advance(10 * MS, 0, 1, 1);
        s.onOperationAbort();

        assertTrue(s.enumerate().isEmpty());
        assertEquals(0, s.pendingDepth());
    }

    @Test
    void helperDeltasAreCountedAsOneCall() {
        KcacheService s = started(TrackLevel.TOP);
        s.onOperationStart();
        probe.advance(0, 0, 2, 0);
        s.onOperationEnd(OUTER, 1.0, List.of(
            new ResourceDelta(3, 0, 0.1, 0.0, true),
            new ResourceDelta(5, 1, 0.2, 0.0, true)));

        OperationStats row = s.enumerate().get(0);
        assertEquals(1, row.calls());
        assertEquals(Long.valueOf(10), row.reads());
        assertEquals(0.3, row.userTime(), 1e-9);
    }

    @Test
    void endWithoutStartIsIgnored() {
        KcacheService s = started(TrackLevel.TOP);
        assertDoesNotThrow(() -> s.onOperationEnd(OUTER, 1.0));
        assertTrue(s.enumerate().isEmpty());
    }

    @Test
    void observationsBeforeInitAreDropped() {
        KcacheService s = service(TrackLevel.TOP);
        s.onOperationStart();
        s.onOperationEnd(OUTER, 1.0);
        s.init(10);
        assertTrue(s.enumerate().isEmpty());
    }

    @Test
    void concurrentHooksCountEveryOperation() throws InterruptedException {
        KcacheService s = started(TrackLevel.TOP);
        int threadCount = 12;
        int perThread = 1_000;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        ExecutorService pool = Executors.newFixedThreadPool(threadCount);

        for (int t = 0; t < threadCount; t++) {
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        s.onOperationStart();
                        s.onOperationEnd(OUTER, 1.0);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals((long) threadCount * perThread, s.enumerate().get(0).calls());
    }

    // --- Control API ---

    @Test
    void reservedPlaceholderIsNotEnumerated() {
        KcacheService s = started(TrackLevel.TOP);
        assertTrue(s.reserve(INNER));
        assertTrue(s.enumerate().isEmpty());
        assertEquals(1, s.table().size());

        s.onOperationStart();
        s.onOperationEnd(INNER, 1.0);
        assertEquals(1, s.enumerate().get(0).calls());
    }

    @Test
    void enumerateFeedsTheSink() {
        KcacheService s = started(TrackLevel.TOP);
        for (Identity id : List.of(OUTER, INNER, new Identity(11, 2, 300L))) {
            s.onOperationStart();
            s.onOperationEnd(id, 1.0);
        }
        List<OperationStats> sunk = new ArrayList<>();
        s.enumerate(sunk::add);
        assertEquals(3, sunk.size());

        List<DatabaseSummary> byDb = s.summarizeByDatabase();
        assertEquals(2, byDb.size());
        assertEquals(2, byDb.get(0).calls());
    }

    // --- Persistence ---

    @Test
    void statisticsSurviveAnOrderlyRestart(@TempDir Path tmp) {
        KcacheService first = new KcacheService(new ResourceSampler(probe, 100), TrackLevel.TOP,
            new PersistenceManager(tmp), true);
        first.init(10);
        first.onOperationStart();
        probe.advance(0, 0, 7, 3);
        first.onOperationEnd(OUTER, 1.0);
        first.shutdown(true);
        assertTrue(Files.exists(tmp.resolve(PersistenceManager.FILE_NAME)));

        KcacheService second = new KcacheService(new ResourceSampler(probe, 100), TrackLevel.TOP,
            new PersistenceManager(tmp), true);
        second.init(10);

        assertEquals(first.enumerate(), second.enumerate());
        assertFalse(Files.exists(tmp.resolve(PersistenceManager.FILE_NAME)));
    }

    @Test
    void unmeasuredBlocksStayNullAcrossRestart(@TempDir Path tmp) {
        FakeResourceProbe noIo = new FakeResourceProbe(false);
        KcacheService first = new KcacheService(new ResourceSampler(noIo, 100), TrackLevel.TOP,
            new PersistenceManager(tmp), true);
        first.init(10);
        first.onOperationStart();
        first.onOperationEnd(OUTER, 1.0);
        first.shutdown(true);

        KcacheService second = new KcacheService(new ResourceSampler(probe, 100), TrackLevel.TOP,
            new PersistenceManager(tmp), true);
        second.init(10);

        OperationStats row = second.enumerate().get(0);
        assertEquals(1, row.calls());
        assertNull(row.reads());
        assertNull(row.writes());
    }

    @Test
    void crashShutdownWritesNothing(@TempDir Path tmp) {
        KcacheService s = new KcacheService(new ResourceSampler(probe, 100), TrackLevel.TOP,
            new PersistenceManager(tmp), true);
        s.init(10);
        s.onOperationStart();
        s.onOperationEnd(OUTER, 1.0);
        s.shutdown(false);
        s.shutdown(true);

        assertFalse(Files.exists(tmp.resolve(PersistenceManager.FILE_NAME)));
    }

    @Test
    void disabledPersistenceDiscardsStaleFile(@TempDir Path tmp) throws Exception {
        Path stale = tmp.resolve(PersistenceManager.FILE_NAME);
        Files.write(stale, new byte[]{ 1, 2, 3 });

        KcacheService s = new KcacheService(new ResourceSampler(probe, 100), TrackLevel.TOP,
            new PersistenceManager(tmp), false);
        s.init(10);
        s.onOperationStart();
        s.onOperationEnd(OUTER, 1.0);
        s.shutdown(true);

        assertFalse(Files.exists(stale));
    }
}
