package com.kcache.agent.report;

import com.google.gson.GsonBuilder;

import java.io.*;
import java.nio.file.*;
import java.util.Comparator;
import java.util.List;
import java.util.function.LongFunction;
import java.util.stream.Collectors;

/**
 * Writes enumerated statistics to a JSON report.
 * Operations are sorted by (database, principal, operation id) so identical state gives identical output.
 */
public class JsonReportWriter {

    public static final String FILE_NAME = "kcache_report.json";
    static final int BLOCK_SIZE = 512;

    public static class ReportException extends RuntimeException {
        public ReportException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * @param symbols resolves an operation id to a readable name; may return null
     */
    public KcacheReport build(List<OperationStats> rows, LongFunction<String> symbols) {
        KcacheReport report = new KcacheReport();
        report.blockSize = BLOCK_SIZE;

        report.operations = rows.stream()
            .sorted(Comparator.comparingLong((OperationStats r) -> r.identity().databaseIdUnsigned())
                .thenComparingLong(r -> r.identity().principalIdUnsigned())
                .thenComparing((a, b) -> Long.compareUnsigned(a.identity().operationId(), b.identity().operationId())))
            .map(r -> {
                KcacheReport.OperationRow o = new KcacheReport.OperationRow();
                o.principalId = r.identity().principalIdUnsigned();
                o.databaseId = r.identity().databaseIdUnsigned();
                o.operationId = Long.toUnsignedString(r.identity().operationId());
                o.symbol = symbols.apply(r.identity().operationId());
                o.calls = r.calls();
                o.reads = r.reads();
                o.readsBytes = r.reads() == null ? null : r.reads() * BLOCK_SIZE;
                o.writes = r.writes();
                o.writesBytes = r.writes() == null ? null : r.writes() * BLOCK_SIZE;
                o.userTime = r.userTime();
                o.systemTime = r.systemTime();
                return o;
            })
            .collect(Collectors.toList());

        report.databases = DatabaseSummary.summarize(rows).stream()
            .map(s -> {
                KcacheReport.DatabaseRow d = new KcacheReport.DatabaseRow();
                d.databaseId = s.databaseId();
                d.calls = s.calls();
                d.reads = s.reads();
                d.writes = s.writes();
                d.userTime = s.userTime();
                d.systemTime = s.systemTime();
                return d;
            })
            .collect(Collectors.toList());

        return report;
    }

    public void write(KcacheReport report, Path outputPath) {
        try {
            Files.createDirectories(outputPath.getParent() != null ? outputPath.getParent() : Path.of("."));
        } catch (IOException e) {
            throw new ReportException("Could not create report directory for " + outputPath, e);
        }
        try (Writer w = new FileWriter(outputPath.toFile())) {
            new GsonBuilder().setPrettyPrinting().serializeNulls().create().toJson(report, w);
        } catch (IOException e) {
            throw new ReportException("Failed to write " + outputPath + ": " + e.getMessage(), e);
        }
        System.err.println("[kcache-agent] " + outputPath.getFileName() + " written: " + outputPath);
    }
}
