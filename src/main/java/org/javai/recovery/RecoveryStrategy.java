package org.javai.recovery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A recovery action template with its retry budget and cost estimate.
 *
 * @param action The action to take
 * @param parameters Action-specific hints (e.g. "initial_delay", "urgency", "require_no_privileges")
 * @param maxAttempts The highest attempt number this strategy still applies to (>= 1)
 * @param backoffMultiplier Delay growth factor between retries (>= 1.0)
 * @param successProbability Estimated chance the action resolves the failure, in [0, 1]
 * @param estimatedTimeSeconds Estimated cost of the action in seconds (>= 0)
 */
public record RecoveryStrategy(
        RecoveryAction action,
        Map<String, Object> parameters,
        int maxAttempts,
        double backoffMultiplier,
        double successProbability,
        long estimatedTimeSeconds
) {

    public static final String MESSAGE = "message";
    public static final String URGENCY = "urgency";

    public RecoveryStrategy {
        Objects.requireNonNull(action, "action must not be null");
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, was: " + backoffMultiplier);
        }
        if (Double.isNaN(successProbability) || successProbability < 0.0 || successProbability > 1.0) {
            throw new IllegalArgumentException("successProbability must be in [0, 1], was: " + successProbability);
        }
        if (estimatedTimeSeconds < 0) {
            throw new IllegalArgumentException("estimatedTimeSeconds must be >= 0, was: " + estimatedTimeSeconds);
        }
    }

    public static Builder builder(RecoveryAction action) {
        return new Builder(action);
    }

    /**
     * Whether this strategy still applies at the given attempt number.
     */
    public boolean allows(int attemptCount) {
        return attemptCount <= maxAttempts;
    }

    public Optional<Object> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    /**
     * Reads a boolean hint; absent or non-boolean values read as false.
     */
    public boolean flag(String name) {
        Object value = parameters.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    /**
     * The urgency hint of an escalation strategy, medium when absent.
     */
    public Urgency urgency() {
        return Urgency.parse(parameters.get(URGENCY));
    }

    public static class Builder {
        private final RecoveryAction action;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private int maxAttempts = 1;
        private double backoffMultiplier = 1.0;
        private double successProbability;
        private long estimatedTimeSeconds;

        private Builder(RecoveryAction action) {
            this.action = Objects.requireNonNull(action);
        }

        public Builder parameter(String name, Object value) {
            parameters.put(Objects.requireNonNull(name), value);
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder successProbability(double successProbability) {
            this.successProbability = successProbability;
            return this;
        }

        public Builder estimatedTimeSeconds(long estimatedTimeSeconds) {
            this.estimatedTimeSeconds = estimatedTimeSeconds;
            return this;
        }

        public RecoveryStrategy build() {
            return new RecoveryStrategy(action, parameters, maxAttempts, backoffMultiplier,
                    successProbability, estimatedTimeSeconds);
        }
    }
}
