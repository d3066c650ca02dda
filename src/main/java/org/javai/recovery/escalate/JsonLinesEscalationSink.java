package org.javai.recovery.escalate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Delivers escalations as JSON lines via SLF4J.
 *
 * <p>Each record becomes one JSON object on one line, suitable for log shippers
 * and ticketing pipelines.
 *
 * <p>Example output:
 * <pre>{@code
 * {"incident_id":"5f0c...","timestamp":"2024-01-20T10:30:00Z","tool":"nmap","target":"10.0.0.5","error_type":"permission_denied",...}
 * }</pre>
 */
public class JsonLinesEscalationSink implements EscalationSink {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.recovery.EscalationJson";

	private final ObjectMapper mapper;
	private final Consumer<String> output;

	/**
	 * Creates a sink writing to the default logger.
	 */
	public JsonLinesEscalationSink() {
		this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a sink writing to the named logger.
	 *
	 * @param loggerName the logger name
	 */
	public JsonLinesEscalationSink(String loggerName) {
		this(LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Creates a sink writing to a specific SLF4J logger at INFO.
	 *
	 * @param logger the logger to use
	 */
	public JsonLinesEscalationSink(Logger logger) {
		this(new ObjectMapper(), logger::info);
	}

	/**
	 * Creates a sink with an explicit line consumer.
	 * Package-private for testing.
	 */
	JsonLinesEscalationSink(ObjectMapper mapper, Consumer<String> output) {
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
		this.output = Objects.requireNonNull(output, "output must not be null");
	}

	@Override
	public void deliver(EscalationRecord record) {
		output.accept(toJson(record));
	}

	/**
	 * Renders a record as a single-line JSON object.
	 *
	 * @throws IllegalStateException if the record cannot be serialized
	 */
	String toJson(EscalationRecord record) {
		try {
			return mapper.writeValueAsString(record.asMap());
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Unable to serialize escalation " + record.incidentId(), e);
		}
	}
}
