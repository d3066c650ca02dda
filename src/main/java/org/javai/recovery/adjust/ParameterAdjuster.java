package org.javai.recovery.adjust;

import org.javai.recovery.ErrorKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Rewrites tool parameters to work around a class of failure.
 *
 * <p>A tool-specific delta for the failure kind is used when one is declared;
 * otherwise a generic delta keyed by kind alone applies. Delta entries replace
 * same-named original parameters, every other original parameter passes through
 * untouched, and the caller's map is never modified. Kinds without any rule
 * leave the parameters unchanged.
 */
public final class ParameterAdjuster {

    private final Map<String, Map<ErrorKind, Map<String, String>>> toolDeltas;
    private final Map<ErrorKind, Map<String, String>> genericDeltas;

    public ParameterAdjuster() {
        this(defaultToolDeltas(), defaultGenericDeltas());
    }

    public ParameterAdjuster(Map<String, Map<ErrorKind, Map<String, String>>> toolDeltas,
                             Map<ErrorKind, Map<String, String>> genericDeltas) {
        Objects.requireNonNull(toolDeltas, "toolDeltas must not be null");
        Objects.requireNonNull(genericDeltas, "genericDeltas must not be null");
        Map<String, Map<ErrorKind, Map<String, String>>> toolCopy = new LinkedHashMap<>();
        toolDeltas.forEach((tool, byKind) -> toolCopy.put(normalize(tool), copyByKind(byKind)));
        this.toolDeltas = Collections.unmodifiableMap(toolCopy);
        this.genericDeltas = copyByKind(genericDeltas);
    }

    /**
     * Returns a new parameter map with the delta for this tool and kind applied.
     *
     * @param tool the tool whose parameters are adjusted
     * @param kind the failure kind being worked around
     * @param originalParameters the parameters of the failed run (may be null)
     * @return a new map; original order is kept and new keys are appended
     */
    public Map<String, String> adjust(String tool, ErrorKind kind, Map<String, String> originalParameters) {
        Map<String, String> adjusted = originalParameters == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(originalParameters);
        adjusted.putAll(deltaFor(tool, kind));
        return adjusted;
    }

    /**
     * The effective delta for a tool and kind: the tool-specific one if declared, else the generic one.
     */
    public Map<String, String> deltaFor(String tool, ErrorKind kind) {
        Map<String, String> specific = toolDeltas.getOrDefault(normalize(tool), Map.of()).get(kind);
        if (specific != null && !specific.isEmpty()) {
            return specific;
        }
        return genericDeltas.getOrDefault(kind, Map.of());
    }

    public boolean hasSpecificRules(String tool) {
        return toolDeltas.containsKey(normalize(tool));
    }

    private static Map<ErrorKind, Map<String, String>> copyByKind(Map<ErrorKind, Map<String, String>> byKind) {
        Map<ErrorKind, Map<String, String>> copy = new EnumMap<>(ErrorKind.class);
        byKind.forEach((kind, delta) -> copy.put(kind, Collections.unmodifiableMap(new LinkedHashMap<>(delta))));
        return Collections.unmodifiableMap(copy);
    }

    private static String normalize(String tool) {
        return tool == null ? "" : tool.trim().toLowerCase(Locale.ROOT);
    }

    // === Default tables ===

    static Map<String, Map<ErrorKind, Map<String, String>>> defaultToolDeltas() {
        Map<String, Map<ErrorKind, Map<String, String>>> table = new LinkedHashMap<>();

        table.put("nmap", Map.of(
                ErrorKind.TIMEOUT, ordered("timing", "-T2", "reduce_ports", "true"),
                ErrorKind.RATE_LIMITED, ordered("timing", "-T1", "delay", "1000ms"),
                ErrorKind.RESOURCE_EXHAUSTED, ordered("max_parallelism", "10")
        ));
        table.put("gobuster", Map.of(
                ErrorKind.TIMEOUT, ordered("threads", "10", "timeout", "30s"),
                ErrorKind.RATE_LIMITED, ordered("threads", "5", "rate-limit", "10"),
                ErrorKind.RESOURCE_EXHAUSTED, ordered("threads", "5")
        ));
        table.put("nuclei", Map.of(
                ErrorKind.TIMEOUT, ordered("concurrency", "10", "timeout", "30"),
                ErrorKind.RATE_LIMITED, ordered("rate-limit", "10", "concurrency", "5"),
                ErrorKind.RESOURCE_EXHAUSTED, ordered("concurrency", "5")
        ));
        table.put("feroxbuster", Map.of(
                ErrorKind.TIMEOUT, ordered("threads", "10", "timeout", "30"),
                ErrorKind.RATE_LIMITED, ordered("threads", "5", "rate-limit", "10"),
                ErrorKind.RESOURCE_EXHAUSTED, ordered("threads", "5")
        ));
        table.put("ffuf", Map.of(
                ErrorKind.TIMEOUT, ordered("threads", "10", "timeout", "30"),
                ErrorKind.RATE_LIMITED, ordered("threads", "5", "rate", "10"),
                ErrorKind.RESOURCE_EXHAUSTED, ordered("threads", "5")
        ));

        return table;
    }

    static Map<ErrorKind, Map<String, String>> defaultGenericDeltas() {
        Map<ErrorKind, Map<String, String>> table = new EnumMap<>(ErrorKind.class);
        table.put(ErrorKind.TIMEOUT, ordered("timeout", "60", "threads", "5"));
        table.put(ErrorKind.RATE_LIMITED, ordered("delay", "2s", "threads", "3"));
        table.put(ErrorKind.RESOURCE_EXHAUSTED, ordered("threads", "3", "memory_limit", "1G"));
        return table;
    }

    private static Map<String, String> ordered(String... keysAndValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }
}
