package org.javai.recovery.strategy;

import org.javai.recovery.RecoveryStrategy;

import java.util.Objects;

/**
 * A viable candidate together with the numbers that ranked it.
 *
 * @param strategy The candidate
 * @param adjustedProbability Success probability discounted by previous attempts
 * @param score Adjusted probability minus the time penalty
 * @param catalogIndex Position of the candidate in its catalog entry
 */
public record ScoredStrategy(
        RecoveryStrategy strategy,
        double adjustedProbability,
        double score,
        int catalogIndex
) {

    public ScoredStrategy {
        Objects.requireNonNull(strategy, "strategy must not be null");
    }
}
