package com.kcache.agent.sampler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Picks the best probe the platform offers. */
public final class ResourceProbes {

    private ResourceProbes() {}

    public static ResourceProbe detect() {
        return detect(ProcfsResourceProbe.THREAD_SELF);
    }

    static ResourceProbe detect(Path threadDir) {
        ResourceProbe portable = new ThreadMxBeanResourceProbe();
        if (procfsUsable(threadDir)) {
            System.err.println("[kcache-agent] resource probe: procfs (" + threadDir + ")");
            return new ProcfsResourceProbe(threadDir, portable);
        }
        System.err.println("[kcache-agent] resource probe: " + portable.name()
            + " (block I/O accounting unavailable)");
        return portable;
    }

    private static boolean procfsUsable(Path threadDir) {
        try {
            ProcfsResourceProbe.parseStat(Files.readString(threadDir.resolve("stat")));
            ProcfsResourceProbe.parseIo(Files.readAllLines(threadDir.resolve("io")));
            return true;
        } catch (IOException | RuntimeException e) {
            return false;
        }
    }
}
