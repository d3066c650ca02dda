package org.javai.recovery.strategy;

import org.javai.recovery.ErrorKind;
import org.javai.recovery.RecoveryAction;
import org.javai.recovery.RecoveryStrategy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The read-only table of candidate recovery strategies per {@link ErrorKind},
 * in declared preference order.
 *
 * <p>The table is built once and never mutated. Every kind has at least one
 * candidate, and {@link ErrorKind#UNKNOWN} always offers both a retry and an
 * escalation, so a first attempt never starts from an empty candidate list.
 */
public final class RecoveryCatalog {

    private final Map<ErrorKind, List<RecoveryStrategy>> entries;

    /**
     * Creates the catalog with the default table.
     */
    public RecoveryCatalog() {
        this(defaultTable());
    }

    /**
     * Creates a catalog over a custom table.
     *
     * @param table candidates per kind; must contain {@link ErrorKind#UNKNOWN} with a retry and an escalation
     * @throws IllegalArgumentException if an entry is empty or the unknown entry is incomplete
     */
    public RecoveryCatalog(Map<ErrorKind, List<RecoveryStrategy>> table) {
        Objects.requireNonNull(table, "table must not be null");
        Map<ErrorKind, List<RecoveryStrategy>> copy = new EnumMap<>(ErrorKind.class);
        table.forEach((kind, strategies) -> {
            if (strategies == null || strategies.isEmpty()) {
                throw new IllegalArgumentException("No strategies declared for " + kind);
            }
            copy.put(kind, List.copyOf(strategies));
        });
        requireUnknownFallback(copy.get(ErrorKind.UNKNOWN));
        this.entries = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the candidates for a kind, falling back to the {@link ErrorKind#UNKNOWN} entry.
     */
    public List<RecoveryStrategy> strategiesFor(ErrorKind kind) {
        List<RecoveryStrategy> strategies = entries.get(kind);
        return strategies != null ? strategies : entries.get(ErrorKind.UNKNOWN);
    }

    public boolean covers(ErrorKind kind) {
        return entries.containsKey(kind);
    }

    private static void requireUnknownFallback(List<RecoveryStrategy> unknown) {
        if (unknown == null) {
            throw new IllegalArgumentException("Catalog must declare strategies for " + ErrorKind.UNKNOWN);
        }
        boolean retry = unknown.stream().anyMatch(s -> s.action().isRetry());
        boolean escalate = unknown.stream().anyMatch(s -> s.action() == RecoveryAction.ESCALATE_TO_HUMAN);
        if (!retry || !escalate) {
            throw new IllegalArgumentException(
                    "Strategies for " + ErrorKind.UNKNOWN + " must include a retry and an escalation");
        }
    }

    // === Default table ===

    static Map<ErrorKind, List<RecoveryStrategy>> defaultTable() {
        Map<ErrorKind, List<RecoveryStrategy>> table = new EnumMap<>(ErrorKind.class);

        table.put(ErrorKind.TIMEOUT, List.of(
                backoff(5, 60, 3, 2.0, 0.7, 30),
                RecoveryStrategy.builder(RecoveryAction.RETRY_WITH_REDUCED_SCOPE)
                        .parameter("reduce_threads", true)
                        .parameter("reduce_timeout", true)
                        .maxAttempts(2).successProbability(0.8).estimatedTimeSeconds(45)
                        .build(),
                switchTool("prefer_faster_tools", 0.6, 60)
        ));

        table.put(ErrorKind.PERMISSION_DENIED, List.of(
                escalate("Privilege escalation required", "medium", 300),
                switchTool("require_no_privileges", 0.5, 30)
        ));

        table.put(ErrorKind.NETWORK_UNREACHABLE, List.of(
                backoff(10, 120, 3, 2.0, 0.6, 60),
                switchTool("prefer_offline_tools", 0.4, 30)
        ));

        table.put(ErrorKind.RATE_LIMITED, List.of(
                backoff(30, 300, 5, 1.5, 0.9, 180),
                RecoveryStrategy.builder(RecoveryAction.ADJUST_PARAMETERS)
                        .parameter("reduce_rate", true)
                        .parameter("increase_delays", true)
                        .maxAttempts(2).successProbability(0.8).estimatedTimeSeconds(120)
                        .build()
        ));

        table.put(ErrorKind.TOOL_NOT_FOUND, List.of(
                switchTool("find_equivalent", 0.7, 15),
                escalate("Tool installation required", "low", 600)
        ));

        table.put(ErrorKind.INVALID_PARAMETERS, List.of(
                RecoveryStrategy.builder(RecoveryAction.ADJUST_PARAMETERS)
                        .parameter("use_defaults", true)
                        .parameter("remove_invalid", true)
                        .maxAttempts(3).successProbability(0.8).estimatedTimeSeconds(10)
                        .build(),
                switchTool("simpler_interface", 0.6, 30)
        ));

        table.put(ErrorKind.RESOURCE_EXHAUSTED, List.of(
                RecoveryStrategy.builder(RecoveryAction.RETRY_WITH_REDUCED_SCOPE)
                        .parameter("reduce_memory", true)
                        .parameter("reduce_threads", true)
                        .maxAttempts(2).successProbability(0.7).estimatedTimeSeconds(60)
                        .build(),
                backoff(60, 300, 2, 2.0, 0.5, 180)
        ));

        table.put(ErrorKind.AUTHENTICATION_FAILED, List.of(
                escalate("Authentication credentials required", "high", 300),
                switchTool("no_auth_required", 0.4, 30)
        ));

        table.put(ErrorKind.TARGET_UNREACHABLE, List.of(
                backoff(15, 180, 3, 2.0, 0.6, 90),
                RecoveryStrategy.builder(RecoveryAction.GRACEFUL_DEGRADATION)
                        .parameter("skip_target", true)
                        .parameter("continue_with_others", true)
                        .maxAttempts(1).successProbability(1.0).estimatedTimeSeconds(5)
                        .build()
        ));

        table.put(ErrorKind.PARSING_ERROR, List.of(
                RecoveryStrategy.builder(RecoveryAction.ADJUST_PARAMETERS)
                        .parameter("change_output_format", true)
                        .parameter("add_parsing_flags", true)
                        .maxAttempts(2).successProbability(0.7).estimatedTimeSeconds(20)
                        .build(),
                switchTool("better_output_format", 0.6, 30)
        ));

        table.put(ErrorKind.UNKNOWN, List.of(
                backoff(5, 30, 2, 2.0, 0.3, 45),
                escalate("Unknown error encountered", "medium", 300)
        ));

        return table;
    }

    private static RecoveryStrategy backoff(int initialDelay, int maxDelay, int maxAttempts,
                                            double multiplier, double probability, long seconds) {
        return RecoveryStrategy.builder(RecoveryAction.RETRY_WITH_BACKOFF)
                .parameter("initial_delay", initialDelay)
                .parameter("max_delay", maxDelay)
                .maxAttempts(maxAttempts)
                .backoffMultiplier(multiplier)
                .successProbability(probability)
                .estimatedTimeSeconds(seconds)
                .build();
    }

    private static RecoveryStrategy switchTool(String hint, double probability, long seconds) {
        return RecoveryStrategy.builder(RecoveryAction.SWITCH_TOOL)
                .parameter(hint, true)
                .maxAttempts(1)
                .successProbability(probability)
                .estimatedTimeSeconds(seconds)
                .build();
    }

    private static RecoveryStrategy escalate(String message, String urgency, long seconds) {
        return RecoveryStrategy.builder(RecoveryAction.ESCALATE_TO_HUMAN)
                .parameter(RecoveryStrategy.MESSAGE, message)
                .parameter(RecoveryStrategy.URGENCY, urgency)
                .maxAttempts(1)
                .successProbability(0.9)
                .estimatedTimeSeconds(seconds)
                .build();
    }
}
