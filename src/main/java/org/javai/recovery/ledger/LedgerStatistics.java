package org.javai.recovery.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view of the incident ledger for monitoring.
 *
 * @param total Number of incidents currently held
 * @param countsByKind Incident counts keyed by error kind value
 * @param countsByTool Incident counts keyed by tool name
 * @param recentCount Number of incidents inside the recent window
 * @param recent The latest incidents inside the window, oldest first, capped for display
 */
public record LedgerStatistics(
        int total,
        Map<String, Long> countsByKind,
        Map<String, Long> countsByTool,
        int recentCount,
        List<RecentIncident> recent
) {

    public LedgerStatistics {
        countsByKind = countsByKind == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(countsByKind));
        countsByTool = countsByTool == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(countsByTool));
        recent = recent == null ? List.of() : List.copyOf(recent);
    }

    public static LedgerStatistics empty() {
        return new LedgerStatistics(0, Map.of(), Map.of(), 0, List.of());
    }
}
