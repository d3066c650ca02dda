package org.javai.recovery;

/**
 * What the caller should do next about a failed tool run.
 */
public enum RecoveryAction {
    RETRY_WITH_BACKOFF("retry_with_backoff"),
    RETRY_WITH_REDUCED_SCOPE("retry_with_reduced_scope"),
    SWITCH_TOOL("switch_tool"),
    ADJUST_PARAMETERS("adjust_parameters"),
    ESCALATE_TO_HUMAN("escalate_to_human"),
    GRACEFUL_DEGRADATION("graceful_degradation"),
    ABORT("abort");

    private final String value;

    RecoveryAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether the action re-runs the same tool against the same target.
     */
    public boolean isRetry() {
        return this == RETRY_WITH_BACKOFF || this == RETRY_WITH_REDUCED_SCOPE;
    }

    /**
     * Whether the action ends autonomous recovery for the operation.
     */
    public boolean isTerminal() {
        return this == ESCALATE_TO_HUMAN || this == ABORT;
    }

    @Override
    public String toString() {
        return value;
    }
}
