package org.javai.recovery.strategy;

import org.javai.recovery.ErrorKind;
import org.javai.recovery.RecoveryAction;
import org.javai.recovery.RecoveryStrategy;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RecoveryCatalogTest {

    private static final RecoveryStrategy RETRY = RecoveryStrategy.builder(RecoveryAction.RETRY_WITH_BACKOFF)
            .maxAttempts(2).successProbability(0.3).estimatedTimeSeconds(45).build();
    private static final RecoveryStrategy ESCALATE = RecoveryStrategy.builder(RecoveryAction.ESCALATE_TO_HUMAN)
            .successProbability(0.9).estimatedTimeSeconds(300).build();

    @Test
    void defaultCatalog_coversEveryKind() {
        RecoveryCatalog catalog = new RecoveryCatalog();

        for (ErrorKind kind : ErrorKind.values()) {
            assertThat(catalog.covers(kind)).as(kind.value()).isTrue();
            assertThat(catalog.strategiesFor(kind)).as(kind.value()).isNotEmpty();
        }
    }

    @Test
    void defaultCatalog_timeoutEntryIsInDeclaredOrder() {
        List<RecoveryStrategy> timeout = new RecoveryCatalog().strategiesFor(ErrorKind.TIMEOUT);

        assertThat(timeout).extracting(RecoveryStrategy::action).containsExactly(
                RecoveryAction.RETRY_WITH_BACKOFF,
                RecoveryAction.RETRY_WITH_REDUCED_SCOPE,
                RecoveryAction.SWITCH_TOOL);
        assertThat(timeout.get(0).parameters())
                .containsEntry("initial_delay", 5)
                .containsEntry("max_delay", 60);
        assertThat(timeout.get(0).backoffMultiplier()).isEqualTo(2.0);
        assertThat(timeout.get(2).flag("prefer_faster_tools")).isTrue();
    }

    @Test
    void defaultCatalog_unknownOffersRetryAndEscalation() {
        List<RecoveryStrategy> unknown = new RecoveryCatalog().strategiesFor(ErrorKind.UNKNOWN);

        assertThat(unknown).extracting(RecoveryStrategy::action)
                .containsExactly(RecoveryAction.RETRY_WITH_BACKOFF, RecoveryAction.ESCALATE_TO_HUMAN);
    }

    @Test
    void customCatalog_missingKindFallsBackToUnknown() {
        Map<ErrorKind, List<RecoveryStrategy>> table = new EnumMap<>(ErrorKind.class);
        table.put(ErrorKind.UNKNOWN, List.of(RETRY, ESCALATE));

        RecoveryCatalog catalog = new RecoveryCatalog(table);

        assertThat(catalog.covers(ErrorKind.TIMEOUT)).isFalse();
        assertThat(catalog.strategiesFor(ErrorKind.TIMEOUT)).containsExactly(RETRY, ESCALATE);
    }

    @Test
    void customCatalog_withoutUnknownEscalation_isRejected() {
        Map<ErrorKind, List<RecoveryStrategy>> table = new EnumMap<>(ErrorKind.class);
        table.put(ErrorKind.UNKNOWN, List.of(RETRY));

        assertThatThrownBy(() -> new RecoveryCatalog(table))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("escalation");
    }

    @Test
    void customCatalog_withEmptyEntry_isRejected() {
        Map<ErrorKind, List<RecoveryStrategy>> table = new EnumMap<>(ErrorKind.class);
        table.put(ErrorKind.UNKNOWN, List.of(RETRY, ESCALATE));
        table.put(ErrorKind.TIMEOUT, List.of());

        assertThatThrownBy(() -> new RecoveryCatalog(table))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeout");
    }

    @Test
    void entries_areImmutable() {
        List<RecoveryStrategy> entry = new RecoveryCatalog().strategiesFor(ErrorKind.RATE_LIMITED);

        assertThatThrownBy(() -> entry.add(RETRY)).isInstanceOf(UnsupportedOperationException.class);
    }
}
