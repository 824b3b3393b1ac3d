package com.kcache.agent;

import com.kcache.agent.report.JsonReportWriter;

import java.nio.file.Path;

/**
 * Orderly-shutdown path: optionally writes kcache_report.json, then saves kcache.stat.
 * Registered via Runtime.getRuntime().addShutdownHook(); the JVM does not run it on a crash.
 */
public class ShutdownHook implements Runnable {

    private final KcacheService service;
    private final SymbolRegistry symbols;
    private final Path reportPath;

    /**
     * @param reportPath where to write the JSON report, or null for no report
     */
    public ShutdownHook(KcacheService service, SymbolRegistry symbols, Path reportPath) {
        this.service = service;
        this.symbols = symbols;
        this.reportPath = reportPath;
    }

    @Override
    public void run() {
        if (reportPath != null) {
            try {
                JsonReportWriter writer = new JsonReportWriter();
                writer.write(writer.build(service.enumerate(), symbols::nameOf), reportPath);
            } catch (Exception e) {
                System.err.println("[kcache-agent] ERROR writing " + reportPath + ": " + e.getMessage());
            }
        }
        service.shutdown(true);
    }
}
