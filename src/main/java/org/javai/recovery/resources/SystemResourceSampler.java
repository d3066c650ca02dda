package org.javai.recovery.resources;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.FileStore;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Samples CPU, memory, disk, load and process count from the running JVM's host.
 *
 * <p>Each metric is read independently; one that cannot be read is left empty
 * and the rest of the snapshot is still returned. If the management bean itself
 * cannot be obtained the snapshot is marked unavailable.
 */
public class SystemResourceSampler implements ResourceSampler {

    private static final Logger LOGGER = LogManager.getLogger(SystemResourceSampler.class);

    private final Supplier<OperatingSystemMXBean> osBean;
    private final Path diskRoot;

    public SystemResourceSampler() {
        this(ManagementFactory::getOperatingSystemMXBean, defaultRoot());
    }

    /**
     * Creates a sampler over explicit sources. Package-private for testing.
     */
    SystemResourceSampler(Supplier<OperatingSystemMXBean> osBean, Path diskRoot) {
        this.osBean = Objects.requireNonNull(osBean, "osBean must not be null");
        this.diskRoot = diskRoot;
    }

    @Override
    public ResourceSnapshot sample() {
        OperatingSystemMXBean os;
        try {
            os = osBean.get();
        } catch (RuntimeException e) {
            LOGGER.debug("Operating system bean not available: {}", e.toString());
            return ResourceSnapshot.unavailable("Unable to get system resources: " + e.getMessage());
        }
        if (os == null) {
            return ResourceSnapshot.unavailable("Unable to get system resources: no operating system bean");
        }
        return ResourceSnapshot.of(
                cpuPercent(os),
                memoryPercent(os),
                diskPercent(),
                loadAverage(os),
                processCount()
        );
    }

    private static Double cpuPercent(OperatingSystemMXBean os) {
        if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
            try {
                double load = extended.getCpuLoad();
                return load < 0 ? null : round(load * 100.0);
            } catch (RuntimeException e) {
                LOGGER.debug("CPU load not readable: {}", e.toString());
            }
        }
        return null;
    }

    private static Double memoryPercent(OperatingSystemMXBean os) {
        if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
            try {
                long total = extended.getTotalMemorySize();
                long free = extended.getFreeMemorySize();
                return total <= 0 ? null : round((total - free) * 100.0 / total);
            } catch (RuntimeException e) {
                LOGGER.debug("Memory usage not readable: {}", e.toString());
            }
        }
        return null;
    }

    private Double diskPercent() {
        if (diskRoot == null) {
            return null;
        }
        try {
            FileStore store = Files.getFileStore(diskRoot);
            long total = store.getTotalSpace();
            long unallocated = store.getUnallocatedSpace();
            return total <= 0 ? null : round((total - unallocated) * 100.0 / total);
        } catch (IOException | RuntimeException e) {
            LOGGER.debug("Disk usage of {} not readable: {}", diskRoot, e.toString());
            return null;
        }
    }

    private static Double loadAverage(OperatingSystemMXBean os) {
        try {
            double load = os.getSystemLoadAverage();
            return load < 0 ? null : round(load);
        } catch (RuntimeException e) {
            LOGGER.debug("Load average not readable: {}", e.toString());
            return null;
        }
    }

    private static Long processCount() {
        try {
            return ProcessHandle.allProcesses().count();
        } catch (RuntimeException e) {
            LOGGER.debug("Process list not readable: {}", e.toString());
            return null;
        }
    }

    private static Path defaultRoot() {
        Iterator<Path> roots = FileSystems.getDefault().getRootDirectories().iterator();
        return roots.hasNext() ? roots.next() : null;
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
