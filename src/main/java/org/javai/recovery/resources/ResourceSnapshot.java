package org.javai.recovery.resources;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A best-effort reading of host load taken when a failure is recorded.
 * Every metric may be null when the host does not expose it.
 *
 * @param cpuPercent System CPU load in percent (may be null)
 * @param memoryPercent Physical memory in use, in percent (may be null)
 * @param diskPercent Root file store usage in percent (may be null)
 * @param loadAverage One-minute system load average (may be null)
 * @param activeProcessCount Number of live processes visible to the JVM (may be null)
 * @param available Whether the snapshot could be taken at all
 * @param unavailableReason Why the snapshot is unavailable (null when available)
 */
public record ResourceSnapshot(
        Double cpuPercent,
        Double memoryPercent,
        Double diskPercent,
        Double loadAverage,
        Long activeProcessCount,
        boolean available,
        String unavailableReason
) {

    public ResourceSnapshot {
        if (available) {
            unavailableReason = null;
        } else if (unavailableReason == null || unavailableReason.isBlank()) {
            unavailableReason = "unavailable";
        }
    }

    public static ResourceSnapshot of(Double cpuPercent, Double memoryPercent, Double diskPercent,
                                      Double loadAverage, Long activeProcessCount) {
        return new ResourceSnapshot(cpuPercent, memoryPercent, diskPercent, loadAverage, activeProcessCount,
                true, null);
    }

    public static ResourceSnapshot unavailable(String reason) {
        return new ResourceSnapshot(null, null, null, null, null, false, reason);
    }

    /**
     * Flattens the snapshot for records and logs. Missing metrics are omitted;
     * an unavailable snapshot renders as a single {@code error} entry.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (!available) {
            map.put("error", unavailableReason);
            return map;
        }
        putIfPresent(map, "cpu_percent", cpuPercent);
        putIfPresent(map, "memory_percent", memoryPercent);
        putIfPresent(map, "disk_percent", diskPercent);
        putIfPresent(map, "load_average", loadAverage);
        putIfPresent(map, "active_processes", activeProcessCount);
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
