package org.javai.recovery;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Tunable constants of the recovery engine.
 *
 * @param ledgerCapacity Maximum number of incidents kept in the ledger
 * @param attemptDiscount Factor applied to a strategy's success probability per previous attempt, in (0, 1]
 * @param timeWeight Divisor turning a strategy's estimated seconds into a score penalty
 * @param recentWindow How far back statistics count an incident as recent
 * @param recentLimit Maximum number of recent incidents listed in statistics
 * @param lineageLimit Maximum number of prior incidents quoted in an escalation
 */
public record RecoverySettings(
        int ledgerCapacity,
        double attemptDiscount,
        double timeWeight,
        Duration recentWindow,
        int recentLimit,
        int lineageLimit
) {

    public static final int DEFAULT_LEDGER_CAPACITY = 1000;
    public static final double DEFAULT_ATTEMPT_DISCOUNT = 0.9;
    public static final double DEFAULT_TIME_WEIGHT = 1000.0;
    public static final Duration DEFAULT_RECENT_WINDOW = Duration.ofHours(1);
    public static final int DEFAULT_RECENT_LIMIT = 10;
    public static final int DEFAULT_LINEAGE_LIMIT = 5;

    public RecoverySettings {
        Objects.requireNonNull(recentWindow, "recentWindow must not be null");
        if (ledgerCapacity < 1) {
            throw new IllegalArgumentException("ledgerCapacity must be >= 1, was: " + ledgerCapacity);
        }
        if (!(attemptDiscount > 0.0 && attemptDiscount <= 1.0)) {
            throw new IllegalArgumentException("attemptDiscount must be in (0, 1], was: " + attemptDiscount);
        }
        if (!(timeWeight > 0.0)) {
            throw new IllegalArgumentException("timeWeight must be > 0, was: " + timeWeight);
        }
        if (recentWindow.isNegative() || recentWindow.isZero()) {
            throw new IllegalArgumentException("recentWindow must be positive, was: " + recentWindow);
        }
        if (recentLimit < 0) {
            throw new IllegalArgumentException("recentLimit must be >= 0, was: " + recentLimit);
        }
        if (lineageLimit < 0) {
            throw new IllegalArgumentException("lineageLimit must be >= 0, was: " + lineageLimit);
        }
    }

    public static RecoverySettings defaults() {
        return new RecoverySettings(DEFAULT_LEDGER_CAPACITY, DEFAULT_ATTEMPT_DISCOUNT, DEFAULT_TIME_WEIGHT,
                DEFAULT_RECENT_WINDOW, DEFAULT_RECENT_LIMIT, DEFAULT_LINEAGE_LIMIT);
    }

    /**
     * Resolves settings from system properties with environment variable fallbacks.
     * Unset values keep their defaults:
     * <ul>
     *   <li>{@code recovery.ledger.capacity} / {@code RECOVERY_LEDGER_CAPACITY}</li>
     *   <li>{@code recovery.selector.discount} / {@code RECOVERY_SELECTOR_DISCOUNT}</li>
     *   <li>{@code recovery.selector.time-weight} / {@code RECOVERY_SELECTOR_TIME_WEIGHT}</li>
     *   <li>{@code recovery.stats.window-minutes} / {@code RECOVERY_STATS_WINDOW_MINUTES}</li>
     *   <li>{@code recovery.stats.recent-limit} / {@code RECOVERY_STATS_RECENT_LIMIT}</li>
     *   <li>{@code recovery.escalation.lineage-limit} / {@code RECOVERY_ESCALATION_LINEAGE_LIMIT}</li>
     * </ul>
     *
     * @throws IllegalStateException if a configured value is malformed
     */
    public static RecoverySettings fromEnvironment() {
        return new RecoverySettings(
                resolve("recovery.ledger.capacity", "RECOVERY_LEDGER_CAPACITY",
                        Integer::parseInt, DEFAULT_LEDGER_CAPACITY),
                resolve("recovery.selector.discount", "RECOVERY_SELECTOR_DISCOUNT",
                        Double::parseDouble, DEFAULT_ATTEMPT_DISCOUNT),
                resolve("recovery.selector.time-weight", "RECOVERY_SELECTOR_TIME_WEIGHT",
                        Double::parseDouble, DEFAULT_TIME_WEIGHT),
                resolve("recovery.stats.window-minutes", "RECOVERY_STATS_WINDOW_MINUTES",
                        value -> Duration.ofMinutes(Long.parseLong(value)), DEFAULT_RECENT_WINDOW),
                resolve("recovery.stats.recent-limit", "RECOVERY_STATS_RECENT_LIMIT",
                        Integer::parseInt, DEFAULT_RECENT_LIMIT),
                resolve("recovery.escalation.lineage-limit", "RECOVERY_ESCALATION_LINEAGE_LIMIT",
                        Integer::parseInt, DEFAULT_LINEAGE_LIMIT)
        );
    }

    public RecoverySettings withLedgerCapacity(int capacity) {
        return new RecoverySettings(capacity, attemptDiscount, timeWeight, recentWindow, recentLimit, lineageLimit);
    }

    static <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
        String value = System.getProperty(sysProp);
        String source = sysProp;
        if (value == null || value.isBlank()) {
            value = System.getenv(envVar);
            source = envVar;
        }
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return parser.apply(value.trim());
        } catch (RuntimeException e) {
            throw new IllegalStateException(
                    "Malformed configuration value '" + value + "' for '" + source + "'", e);
        }
    }
}
