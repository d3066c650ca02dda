package org.javai.recovery.resources;

/**
 * Reads host resource usage for failure diagnostics.
 * Implementations must not throw; a failed read yields {@link ResourceSnapshot#unavailable(String)}.
 */
@FunctionalInterface
public interface ResourceSampler {

    ResourceSnapshot sample();

    /**
     * A sampler that never touches the host. Useful for testing.
     */
    static ResourceSampler disabled() {
        return () -> ResourceSnapshot.unavailable("resource sampling disabled");
    }

    /**
     * The default sampler backed by the JVM management beans.
     */
    static ResourceSampler system() {
        return new SystemResourceSampler();
    }
}
