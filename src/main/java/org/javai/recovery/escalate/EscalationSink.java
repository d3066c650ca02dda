package org.javai.recovery.escalate;

/**
 * Receives escalation records for delivery to humans.
 * Implementations might write structured logs, open tickets or page an operator;
 * this library only ships log-based sinks.
 */
@FunctionalInterface
public interface EscalationSink {

	/**
	 * Delivers one escalation.
	 */
	void deliver(EscalationRecord record);

	/**
	 * A sink that does nothing. Useful for testing.
	 */
	static EscalationSink noOp() {
		return record -> {};
	}

	/**
	 * Creates a composite sink that fans out to all given sinks.
	 *
	 * @param sinks the sinks to delegate to
	 * @return a composite sink
	 */
	static EscalationSink composite(EscalationSink... sinks) {
		return CompositeEscalationSink.of(sinks);
	}
}
