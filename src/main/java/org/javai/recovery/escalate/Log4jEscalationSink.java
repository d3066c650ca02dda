package org.javai.recovery.escalate;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.recovery.Urgency;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Delivers escalations as Log4j2 log lines.
 *
 * <p>The level follows the record's {@link Urgency}:
 * <ul>
 *   <li>{@code HIGH} → ERROR</li>
 *   <li>{@code MEDIUM} → WARN</li>
 *   <li>{@code LOW} → INFO</li>
 * </ul>
 *
 * <p>Every line carries the {@code ESCALATION} marker so log routing can send
 * escalations to a dedicated appender.
 */
public class Log4jEscalationSink implements EscalationSink {

	static final Marker ESCALATION_MARKER = MarkerManager.getMarker("ESCALATION");

	private final Logger logger;

	/**
	 * Creates a sink using the default logger name.
	 */
	public Log4jEscalationSink() {
		this(LogManager.getLogger("org.javai.recovery.Escalation"));
	}

	/**
	 * Creates a sink with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jEscalationSink(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a sink with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jEscalationSink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void deliver(EscalationRecord record) {
		logger.atLevel(levelFor(record.urgency()))
			.withMarker(ESCALATION_MARKER)
			.log(format(record));
	}

	static Level levelFor(Urgency urgency) {
		return switch (urgency) {
			case HIGH -> Level.ERROR;
			case MEDIUM -> Level.WARN;
			case LOW -> Level.INFO;
		};
	}

	static String format(EscalationRecord record) {
		return """
			Escalation [%s] for %s on %s: %s \
			| incident=%s, attempts=%d, error=%s%s%s\
			""".formatted(
				record.urgency().value(),
				record.tool(),
				record.target(),
				record.errorKind().value(),
				record.incidentId(),
				record.attemptCount(),
				record.errorMessage(),
				formatParameters(record.parameters()),
				formatSuggestions(record.suggestedActions())
			).trim();
	}

	private static String formatParameters(Map<String, String> parameters) {
		if (parameters.isEmpty()) {
			return "";
		}
		return ", parameters={" + parameters.entrySet().stream()
			.map(e -> e.getKey() + "=" + e.getValue())
			.collect(Collectors.joining(", ")) + "}";
	}

	private static String formatSuggestions(List<String> suggestions) {
		if (suggestions.isEmpty()) {
			return "";
		}
		return ", suggestions=[" + String.join("; ", suggestions) + "]";
	}
}
