package com.kcache.agent.sampler;

/**
 * Resources consumed by one monitored operation.
 * reads/writes are in 512-byte blocks and are meaningless when {@code ioAvailable} is false.
 */
public record ResourceDelta(
    long reads,
    long writes,
    double userTime,
    double systemTime,
    boolean ioAvailable
) {

    public static final ResourceDelta ZERO = new ResourceDelta(0, 0, 0.0, 0.0, true);

    /**
     * Merges the contribution of a helper context working on the same logical operation.
     * I/O stays available only if both sides measured it.
     */
    public ResourceDelta plus(ResourceDelta other) {
        return new ResourceDelta(
            reads + other.reads,
            writes + other.writes,
            userTime + other.userTime,
            systemTime + other.systemTime,
            ioAvailable && other.ioAvailable
        );
    }
}
