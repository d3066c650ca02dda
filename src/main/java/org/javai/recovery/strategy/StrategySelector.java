package org.javai.recovery.strategy;

import org.javai.recovery.FailureContext;
import org.javai.recovery.RecoveryAction;
import org.javai.recovery.RecoverySettings;
import org.javai.recovery.RecoveryStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Picks the most promising recovery strategy for a failure given how often the
 * operation has already been attempted.
 *
 * <p>Only candidates whose {@code maxAttempts} still admit the current attempt
 * are considered. Each is scored as
 * {@code successProbability * discount^(attempt-1) - estimatedTimeSeconds / timeWeight};
 * the highest score wins and ties go to the candidate declared first. When no
 * candidate admits the attempt the selector returns a terminal escalation instead
 * of failing.
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
public final class StrategySelector {

    private static final Comparator<ScoredStrategy> BEST_FIRST =
            Comparator.comparingDouble(ScoredStrategy::score).reversed()
                    .thenComparingInt(ScoredStrategy::catalogIndex);

    private final double attemptDiscount;
    private final double timeWeight;

    public StrategySelector() {
        this(RecoverySettings.DEFAULT_ATTEMPT_DISCOUNT, RecoverySettings.DEFAULT_TIME_WEIGHT);
    }

    public StrategySelector(RecoverySettings settings) {
        this(settings.attemptDiscount(), settings.timeWeight());
    }

    public StrategySelector(double attemptDiscount, double timeWeight) {
        if (!(attemptDiscount > 0.0 && attemptDiscount <= 1.0)) {
            throw new IllegalArgumentException("attemptDiscount must be in (0, 1], was: " + attemptDiscount);
        }
        if (!(timeWeight > 0.0)) {
            throw new IllegalArgumentException("timeWeight must be > 0, was: " + timeWeight);
        }
        this.attemptDiscount = attemptDiscount;
        this.timeWeight = timeWeight;
    }

    /**
     * Selects a strategy. Never fails and never returns null.
     *
     * @param strategies candidates in catalog order
     * @param context the failure being recovered from
     * @return the best viable candidate, or the terminal escalation when none is viable
     */
    public RecoveryStrategy select(List<RecoveryStrategy> strategies, FailureContext context) {
        Objects.requireNonNull(context, "context must not be null");
        List<ScoredStrategy> ranked = rank(strategies, context.attemptCount());
        if (ranked.isEmpty()) {
            return exhausted(context.toolName());
        }
        return ranked.get(0).strategy();
    }

    /**
     * Ranks the viable candidates for an attempt, best first.
     *
     * @param strategies candidates in catalog order (may be null or empty)
     * @param attemptCount the 1-based attempt number
     * @return scored viable candidates; empty when every candidate is exhausted
     */
    public List<ScoredStrategy> rank(List<RecoveryStrategy> strategies, int attemptCount) {
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be >= 1, was: " + attemptCount);
        }
        List<ScoredStrategy> scored = new ArrayList<>();
        if (strategies == null) {
            return scored;
        }
        for (int i = 0; i < strategies.size(); i++) {
            RecoveryStrategy strategy = strategies.get(i);
            if (!strategy.allows(attemptCount)) {
                continue;
            }
            double adjusted = adjustedProbability(strategy, attemptCount);
            double score = adjusted - strategy.estimatedTimeSeconds() / timeWeight;
            scored.add(new ScoredStrategy(strategy, adjusted, score, i));
        }
        scored.sort(BEST_FIRST);
        return scored;
    }

    /**
     * The success probability of a strategy after discounting previous failed attempts.
     */
    public double adjustedProbability(RecoveryStrategy strategy, int attemptCount) {
        return strategy.successProbability() * Math.pow(attemptDiscount, attemptCount - 1);
    }

    /**
     * The terminal strategy returned once every candidate is exhausted.
     */
    public static RecoveryStrategy exhausted(String toolName) {
        return RecoveryStrategy.builder(RecoveryAction.ESCALATE_TO_HUMAN)
                .parameter(RecoveryStrategy.MESSAGE, "All recovery strategies exhausted for " + toolName)
                .parameter(RecoveryStrategy.URGENCY, "high")
                .maxAttempts(1)
                .backoffMultiplier(1.0)
                .successProbability(0.9)
                .estimatedTimeSeconds(300)
                .build();
    }
}
