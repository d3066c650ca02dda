package org.javai.recovery.escalate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.recovery.FailureContext;
import org.javai.recovery.RecoverySettings;
import org.javai.recovery.Urgency;
import org.javai.recovery.ledger.IncidentLedger;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds escalation records from failure contexts and hands them to a sink.
 *
 * <p>The prior incidents quoted in a record are resolved through the ledger, so
 * incidents evicted since the failure was recorded are silently left out.
 * A failing sink is logged and never breaks the caller.
 */
public class EscalationReporter {

	private static final Logger LOGGER = LogManager.getLogger(EscalationReporter.class);

	private final IncidentLedger ledger;
	private final EscalationSink sink;
	private final int lineageLimit;

	public EscalationReporter(IncidentLedger ledger, EscalationSink sink) {
		this(ledger, sink, RecoverySettings.DEFAULT_LINEAGE_LIMIT);
	}

	/**
	 * @param ledger the ledger prior incidents are resolved against
	 * @param sink where records are delivered
	 * @param lineageLimit maximum number of prior incidents quoted per record
	 */
	public EscalationReporter(IncidentLedger ledger, EscalationSink sink, int lineageLimit) {
		this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
		this.sink = Objects.requireNonNull(sink, "sink must not be null");
		if (lineageLimit < 0) {
			throw new IllegalArgumentException("lineageLimit must be >= 0, was: " + lineageLimit);
		}
		this.lineageLimit = lineageLimit;
	}

	/**
	 * Builds the record for a failure and delivers it.
	 *
	 * @param context the failure to escalate
	 * @param urgency how quickly a human should react (null reads as medium)
	 * @return the delivered record
	 */
	public EscalationRecord escalate(FailureContext context, Urgency urgency) {
		Objects.requireNonNull(context, "context must not be null");
		EscalationRecord record = buildRecord(context, urgency == null ? Urgency.MEDIUM : urgency);
		try {
			sink.deliver(record);
		} catch (RuntimeException e) {
			LOGGER.error("Failed to deliver escalation for incident {} of {}",
					record.incidentId(), record.tool(), e);
		}
		return record;
	}

	EscalationRecord buildRecord(FailureContext context, Urgency urgency) {
		return new EscalationRecord(
				context.id(),
				context.occurredAt(),
				context.toolName(),
				context.target(),
				context.errorKind(),
				context.errorMessage(),
				context.attemptCount(),
				urgency,
				HumanSuggestions.forKind(context.errorKind(), context.toolName()),
				context.parameters(),
				context.resources().asMap(),
				recentErrors(context)
		);
	}

	private List<String> recentErrors(FailureContext context) {
		List<FailureContext> prior = ledger.resolve(context.previousIncidents());
		int from = Math.max(0, prior.size() - lineageLimit);
		return prior.subList(from, prior.size()).stream()
				.map(FailureContext::errorMessage)
				.collect(Collectors.toUnmodifiableList());
	}
}
