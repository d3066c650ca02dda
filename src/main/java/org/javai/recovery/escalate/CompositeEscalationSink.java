package org.javai.recovery.escalate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An {@link EscalationSink} that delegates to multiple sinks.
 *
 * <p>Every configured sink receives every record. If a sink throws, the error is
 * logged and the remaining sinks still run.
 *
 * <pre>{@code
 * EscalationSink sink = CompositeEscalationSink.builder()
 *     .add(new Log4jEscalationSink())
 *     .addIf(jsonEnabled, new JsonLinesEscalationSink())
 *     .build();
 * }</pre>
 */
public final class CompositeEscalationSink implements EscalationSink {

	private static final Logger LOGGER = LogManager.getLogger(CompositeEscalationSink.class);

	private final List<EscalationSink> sinks;

	private CompositeEscalationSink(List<EscalationSink> sinks) {
		this.sinks = List.copyOf(sinks);
	}

	public static CompositeEscalationSink of(EscalationSink... sinks) {
		return new CompositeEscalationSink(Arrays.asList(sinks));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void deliver(EscalationRecord record) {
		for (EscalationSink sink : sinks) {
			try {
				sink.deliver(record);
			} catch (RuntimeException e) {
				LOGGER.error("Escalation sink {} failed for incident {}",
						sink.getClass().getName(), record.incidentId(), e);
			}
		}
	}

	/**
	 * Returns the number of sinks in this composite.
	 */
	public int size() {
		return sinks.size();
	}

	public static final class Builder {
		private final List<EscalationSink> sinks = new ArrayList<>();

		private Builder() {}

		public Builder add(EscalationSink sink) {
			if (sink != null) {
				sinks.add(sink);
			}
			return this;
		}

		/**
		 * Adds the sink only when the condition holds.
		 */
		public Builder addIf(boolean condition, EscalationSink sink) {
			if (condition) {
				add(sink);
			}
			return this;
		}

		public CompositeEscalationSink build() {
			return new CompositeEscalationSink(sinks);
		}
	}
}
