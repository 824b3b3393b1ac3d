package com.kcache.agent.sampler;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;

/**
 * Portable probe: CPU time from the JVM's thread MXBean, no block I/O.
 * System time is derived as thread CPU time minus user time.
 */
public class ThreadMxBeanResourceProbe implements ResourceProbe {

    private final ThreadMXBean threads = ManagementFactory.getThreadMXBean();
    private final boolean cpuTimeSupported;

    public ThreadMxBeanResourceProbe() {
        boolean supported = threads.isCurrentThreadCpuTimeSupported();
        if (supported && !threads.isThreadCpuTimeEnabled()) {
            try {
                threads.setThreadCpuTimeEnabled(true);
            } catch (UnsupportedOperationException | SecurityException e) {
                System.err.println("[kcache-agent] WARNING: cannot enable thread CPU time: " + e.getMessage());
                supported = false;
            }
        }
        this.cpuTimeSupported = supported;
    }

    @Override
    public RawUsage read() {
        if (!cpuTimeSupported) {
            return new RawUsage(0, 0, 0, 0, false);
        }
        long user = threads.getCurrentThreadUserTime();
        long cpu = threads.getCurrentThreadCpuTime();
        if (user < 0 || cpu < 0) {
            return new RawUsage(0, 0, 0, 0, false);
        }
        return new RawUsage(user, Math.max(0, cpu - user), 0, 0, false);
    }

    @Override
    public boolean ioAvailable() {
        return false;
    }

    @Override
    public String name() {
        return "thread-mxbean";
    }
}
