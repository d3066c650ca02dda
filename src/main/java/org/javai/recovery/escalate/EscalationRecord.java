package org.javai.recovery.escalate;

import org.javai.recovery.ErrorKind;
import org.javai.recovery.IncidentId;
import org.javai.recovery.Urgency;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a human operator needs to take over a failure.
 *
 * @param incidentId The escalated incident
 * @param timestamp When the failure was recorded
 * @param tool The tool that failed
 * @param target The scan target
 * @param errorKind The classified kind
 * @param errorMessage The raw error text
 * @param attemptCount Attempts made before escalating
 * @param urgency How quickly a human should react
 * @param suggestedActions Remediation steps for the operator
 * @param parameters The tool parameters of the failed run
 * @param systemResources Host resource snapshot, or a single {@code error} entry when unavailable
 * @param recentErrors Messages of the latest prior incidents of the same tool and target, oldest first
 */
public record EscalationRecord(
		IncidentId incidentId,
		Instant timestamp,
		String tool,
		String target,
		ErrorKind errorKind,
		String errorMessage,
		int attemptCount,
		Urgency urgency,
		List<String> suggestedActions,
		Map<String, String> parameters,
		Map<String, Object> systemResources,
		List<String> recentErrors
) {

	public EscalationRecord {
		Objects.requireNonNull(incidentId, "incidentId must not be null");
		Objects.requireNonNull(timestamp, "timestamp must not be null");
		Objects.requireNonNull(tool, "tool must not be null");
		Objects.requireNonNull(errorKind, "errorKind must not be null");
		Objects.requireNonNull(urgency, "urgency must not be null");
		suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
		parameters = parameters == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
		systemResources = systemResources == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(systemResources));
		recentErrors = recentErrors == null ? List.of() : List.copyOf(recentErrors);
	}

	/**
	 * Flattens the record into ordered fields for serialization.
	 */
	public Map<String, Object> asMap() {
		Map<String, Object> context = new LinkedHashMap<>();
		context.put("parameters", parameters);
		context.put("system_resources", systemResources);
		context.put("recent_errors", recentErrors);

		Map<String, Object> map = new LinkedHashMap<>();
		map.put("incident_id", incidentId.value());
		map.put("timestamp", timestamp.toString());
		map.put("tool", tool);
		map.put("target", target);
		map.put("error_type", errorKind.value());
		map.put("error_message", errorMessage);
		map.put("attempt_count", attemptCount);
		map.put("urgency", urgency.value());
		map.put("suggested_actions", suggestedActions);
		map.put("context", context);
		return map;
	}
}
