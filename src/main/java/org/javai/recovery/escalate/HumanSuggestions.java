package org.javai.recovery.escalate;

import org.javai.recovery.ErrorKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Remediation steps shown to an operator, keyed by error kind.
 * A {@code {tool}} placeholder is replaced by the failing tool's name.
 */
public final class HumanSuggestions {

	static final List<String> FALLBACK = List.of("Review error details and logs");

	private static final Map<ErrorKind, List<String>> SUGGESTIONS;

	static {
		Map<ErrorKind, List<String>> table = new EnumMap<>(ErrorKind.class);
		table.put(ErrorKind.PERMISSION_DENIED, List.of(
				"Run the command with sudo privileges",
				"Check file/directory permissions",
				"Verify user is in required groups"));
		table.put(ErrorKind.TOOL_NOT_FOUND, List.of(
				"Install {tool} using package manager",
				"Check if tool is in PATH",
				"Verify tool installation"));
		table.put(ErrorKind.NETWORK_UNREACHABLE, List.of(
				"Check network connectivity",
				"Verify target is accessible",
				"Check firewall rules"));
		table.put(ErrorKind.RATE_LIMITED, List.of(
				"Wait before retrying",
				"Use slower scan rates",
				"Check API rate limits"));
		table.put(ErrorKind.AUTHENTICATION_FAILED, List.of(
				"Verify the configured credentials",
				"Refresh expired tokens or sessions"));
		table.put(ErrorKind.RESOURCE_EXHAUSTED, List.of(
				"Free memory or disk space on the host",
				"Reduce concurrency of running scans"));
		SUGGESTIONS = Collections.unmodifiableMap(table);
	}

	private HumanSuggestions() {
		// Utility class
	}

	/**
	 * Returns the suggestions for a kind with the tool name filled in.
	 */
	public static List<String> forKind(ErrorKind kind, String tool) {
		List<String> templates = SUGGESTIONS.getOrDefault(kind, FALLBACK);
		String toolName = tool == null ? "the tool" : tool;
		return templates.stream()
				.map(template -> template.replace("{tool}", toolName))
				.collect(Collectors.toUnmodifiableList());
	}
}
