package org.javai.recovery;

import org.javai.recovery.resources.ResourceSnapshot;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The immutable record of one observed tool failure and its surroundings.
 *
 * @param id The incident identifier
 * @param toolName The tool that failed (e.g. "nmap")
 * @param target The scan target
 * @param parameters The tool parameters of the failed run
 * @param errorKind The classified failure category
 * @param errorMessage The raw error text
 * @param attemptCount 1-based attempt number of the logical operation
 * @param occurredAt When the failure was recorded
 * @param stackTrace Diagnostic stack trace (may be empty)
 * @param resources Host resource snapshot at the time of failure
 * @param previousIncidents The latest earlier incidents of the same tool and target, oldest first
 */
public record FailureContext(
        IncidentId id,
        String toolName,
        String target,
        Map<String, String> parameters,
        ErrorKind errorKind,
        String errorMessage,
        int attemptCount,
        Instant occurredAt,
        String stackTrace,
        ResourceSnapshot resources,
        List<IncidentId> previousIncidents
) {

    public FailureContext {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(errorKind, "errorKind must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be >= 1, was: " + attemptCount);
        }
        target = target == null ? ToolInvocation.UNKNOWN_TARGET : target;
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        errorMessage = errorMessage == null ? "" : errorMessage;
        stackTrace = stackTrace == null ? "" : stackTrace;
        resources = resources == null ? ResourceSnapshot.unavailable("not sampled") : resources;
        previousIncidents = previousIncidents == null ? List.of() : List.copyOf(previousIncidents);
    }

    /**
     * Creates a builder for the required fields; everything else has a default.
     */
    public static Builder builder(String toolName, ErrorKind errorKind) {
        return new Builder(toolName, errorKind);
    }

    /**
     * Whether this incident belongs to the given tool and target lineage.
     */
    public boolean sameLineage(String tool, String otherTarget) {
        return toolName.equals(tool) && target.equals(otherTarget);
    }

    public static class Builder {
        private final String toolName;
        private final ErrorKind errorKind;
        private IncidentId id = IncidentId.random();
        private String target;
        private Map<String, String> parameters;
        private String errorMessage;
        private int attemptCount = 1;
        private Instant occurredAt = Instant.now();
        private String stackTrace;
        private ResourceSnapshot resources;
        private List<IncidentId> previousIncidents;

        private Builder(String toolName, ErrorKind errorKind) {
            this.toolName = Objects.requireNonNull(toolName);
            this.errorKind = Objects.requireNonNull(errorKind);
        }

        public Builder id(IncidentId id) {
            this.id = id;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder attemptCount(int attemptCount) {
            this.attemptCount = attemptCount;
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder stackTrace(String stackTrace) {
            this.stackTrace = stackTrace;
            return this;
        }

        public Builder resources(ResourceSnapshot resources) {
            this.resources = resources;
            return this;
        }

        public Builder previousIncidents(List<IncidentId> previousIncidents) {
            this.previousIncidents = previousIncidents;
            return this;
        }

        public FailureContext build() {
            return new FailureContext(id, toolName, target, parameters, errorKind, errorMessage,
                    attemptCount, occurredAt, stackTrace, resources, previousIncidents);
        }
    }
}
