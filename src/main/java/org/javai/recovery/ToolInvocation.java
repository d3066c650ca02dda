package org.javai.recovery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the caller was doing when the tool failed.
 *
 * @param target The scan target (defaults to "unknown")
 * @param parameters The tool parameters of the failed run (insertion order preserved)
 * @param attemptCount 1-based attempt number of this logical operation
 */
public record ToolInvocation(String target, Map<String, String> parameters, int attemptCount) {

    public static final String UNKNOWN_TARGET = "unknown";

    public ToolInvocation {
        target = target == null || target.isBlank() ? UNKNOWN_TARGET : target;
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be >= 1, was: " + attemptCount);
        }
    }

    public static ToolInvocation firstAttempt(String target, Map<String, String> parameters) {
        return new ToolInvocation(target, parameters, 1);
    }

    /**
     * The same invocation, one attempt later.
     */
    public ToolInvocation nextAttempt() {
        return new ToolInvocation(target, parameters, attemptCount + 1);
    }

    /**
     * The same attempt with replacement parameters, e.g. after an adjustment.
     */
    public ToolInvocation withParameters(Map<String, String> newParameters) {
        return new ToolInvocation(target, newParameters, attemptCount);
    }
}
