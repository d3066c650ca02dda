package org.javai.recovery;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RecoveryStrategyTest {

    @Test
    void builder_appliesDefaults() {
        RecoveryStrategy strategy = RecoveryStrategy.builder(RecoveryAction.SWITCH_TOOL)
                .successProbability(0.6)
                .build();

        assertThat(strategy.maxAttempts()).isEqualTo(1);
        assertThat(strategy.backoffMultiplier()).isEqualTo(1.0);
        assertThat(strategy.parameters()).isEmpty();
        assertThat(strategy.allows(1)).isTrue();
        assertThat(strategy.allows(2)).isFalse();
    }

    @Test
    void invalidValues_areRejected() {
        assertThatThrownBy(() -> RecoveryStrategy.builder(RecoveryAction.ABORT).maxAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecoveryStrategy.builder(RecoveryAction.ABORT).backoffMultiplier(0.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecoveryStrategy.builder(RecoveryAction.ABORT).successProbability(1.2).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecoveryStrategy.builder(RecoveryAction.ABORT).estimatedTimeSeconds(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void flagAndUrgency_readParameters() {
        RecoveryStrategy strategy = RecoveryStrategy.builder(RecoveryAction.ESCALATE_TO_HUMAN)
                .parameter(RecoveryStrategy.URGENCY, "high")
                .parameter("require_no_privileges", true)
                .parameter("reduce_rate", "true")
                .build();

        assertThat(strategy.urgency()).isEqualTo(Urgency.HIGH);
        assertThat(strategy.flag("require_no_privileges")).isTrue();
        assertThat(strategy.flag("reduce_rate")).isTrue();
        assertThat(strategy.flag("missing")).isFalse();
    }

    @Test
    void urgency_absentOrUnknown_isMedium() {
        assertThat(Urgency.parse(null)).isEqualTo(Urgency.MEDIUM);
        assertThat(Urgency.parse("urgent")).isEqualTo(Urgency.MEDIUM);
        assertThat(Urgency.parse("LOW")).isEqualTo(Urgency.LOW);
    }

    @Test
    void parameters_areImmutable() {
        RecoveryStrategy strategy = RecoveryStrategy.builder(RecoveryAction.RETRY_WITH_BACKOFF)
                .parameter("initial_delay", 5)
                .build();

        assertThatThrownBy(() -> strategy.parameters().put("max_delay", 60))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void actions_reportRetryAndTerminal() {
        assertThat(RecoveryAction.RETRY_WITH_BACKOFF.isRetry()).isTrue();
        assertThat(RecoveryAction.RETRY_WITH_REDUCED_SCOPE.isRetry()).isTrue();
        assertThat(RecoveryAction.SWITCH_TOOL.isRetry()).isFalse();
        assertThat(RecoveryAction.ESCALATE_TO_HUMAN.isTerminal()).isTrue();
        assertThat(RecoveryAction.ABORT.isTerminal()).isTrue();
        assertThat(RecoveryAction.ADJUST_PARAMETERS.value()).isEqualTo("adjust_parameters");
    }

    @Test
    void errorKind_roundTripsItsValue() {
        assertThat(ErrorKind.fromValue("Rate_Limited")).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThatThrownBy(() -> ErrorKind.fromValue("boom"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
