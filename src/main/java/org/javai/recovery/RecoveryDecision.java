package org.javai.recovery;

import org.javai.recovery.escalate.EscalationRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of handling one tool failure.
 *
 * @param incident The failure as recorded in the ledger
 * @param strategy What the caller should do next
 * @param escalation The record handed to humans, present when the strategy escalates
 */
public record RecoveryDecision(
        FailureContext incident,
        RecoveryStrategy strategy,
        Optional<EscalationRecord> escalation
) {

    public RecoveryDecision {
        Objects.requireNonNull(incident, "incident must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        escalation = escalation == null ? Optional.empty() : escalation;
    }

    public RecoveryAction action() {
        return strategy.action();
    }

    public ErrorKind errorKind() {
        return incident.errorKind();
    }

    public boolean escalated() {
        return escalation.isPresent();
    }
}
