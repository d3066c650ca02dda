package org.javai.recovery;

import org.javai.recovery.escalate.EscalationRecord;
import org.javai.recovery.ledger.LedgerStatistics;
import org.javai.recovery.resources.ResourceSampler;
import org.javai.recovery.resources.ResourceSnapshot;
import org.javai.recovery.substitute.SubstitutionConstraint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RecoveryEngineTest {

    private static final Instant NOW = Instant.parse("2024-01-20T10:30:00Z");

    private List<EscalationRecord> escalations;
    private RecoveryEngine engine;

    @BeforeEach
    void setUp() {
        escalations = new ArrayList<>();
        engine = RecoveryEngine.builder()
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .sampler(() -> ResourceSnapshot.of(20.0, 40.0, 60.0, 0.5, 150L))
                .sink(escalations::add)
                .build();
    }

    @Test
    void gobusterRateLimited_backsOffThenAdjustsParameters() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("url", "https://example.com");
        parameters.put("threads", "50");
        ToolInvocation invocation = ToolInvocation.firstAttempt("example.com", parameters);

        RecoveryDecision decision = engine.decide("gobuster", ToolError.of("rate limit exceeded (429)"), invocation);

        assertThat(decision.errorKind()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(decision.action()).isEqualTo(RecoveryAction.RETRY_WITH_BACKOFF);
        assertThat(decision.escalated()).isFalse();
        assertThat(escalations).isEmpty();

        Map<String, String> adjusted = engine.adjustParameters("gobuster", decision.errorKind(), parameters);

        assertThat(adjusted).containsExactly(
                entry("url", "https://example.com"),
                entry("threads", "5"),
                entry("rate-limit", "10"));
        assertThat(parameters).containsEntry("threads", "50");
    }

    @Test
    void permissionDenied_escalatesAndOffersUnprivilegedSubstitute() {
        ToolInvocation invocation = ToolInvocation.firstAttempt("10.0.0.5", Map.of("scan_type", "-sS"));

        RecoveryDecision decision = engine.decide("nmap",
                ToolError.of("You requested a scan type which requires root privileges. QUITTING! Permission denied"),
                invocation);

        assertThat(decision.action()).isEqualTo(RecoveryAction.ESCALATE_TO_HUMAN);
        assertThat(decision.escalation()).isPresent();
        assertThat(escalations).hasSize(1);
        EscalationRecord record = escalations.get(0);
        assertThat(record.urgency()).isEqualTo(Urgency.MEDIUM);
        assertThat(record.incidentId()).isEqualTo(decision.incident().id());
        assertThat(record.systemResources()).containsEntry("cpu_percent", 20.0);

        assertThat(engine.getAlternative("nmap", EnumSet.of(SubstitutionConstraint.REQUIRE_NO_PRIVILEGES)))
                .contains("rustscan");
    }

    @Test
    void toolNotFound_switchesToEquivalentTool() {
        RecoveryDecision decision = engine.decide("gobuster",
                ToolError.of("gobuster: command not found"), ToolInvocation.firstAttempt("example.com", null));

        assertThat(decision.action()).isEqualTo(RecoveryAction.SWITCH_TOOL);
        assertThat(engine.getAlternative("gobuster", decision.strategy())).contains("feroxbuster");
    }

    @Test
    void repeatedFailures_exhaustToHighUrgencyEscalation() {
        ToolInvocation invocation = ToolInvocation.firstAttempt("10.0.0.5", Map.of());
        ToolError error = ToolError.of("Connection timed out");

        List<RecoveryAction> actions = new ArrayList<>();
        for (int attempt = 1; attempt <= 4; attempt++) {
            actions.add(engine.handleFailure("nmap", error, invocation).action());
            invocation = invocation.nextAttempt();
        }

        assertThat(actions).containsExactly(
                RecoveryAction.RETRY_WITH_REDUCED_SCOPE,
                RecoveryAction.RETRY_WITH_REDUCED_SCOPE,
                RecoveryAction.RETRY_WITH_BACKOFF,
                RecoveryAction.ESCALATE_TO_HUMAN);
        assertThat(escalations).hasSize(1);
        EscalationRecord record = escalations.get(0);
        assertThat(record.urgency()).isEqualTo(Urgency.HIGH);
        assertThat(record.attemptCount()).isEqualTo(4);
        assertThat(record.recentErrors()).containsExactly(
                "Connection timed out", "Connection timed out", "Connection timed out");
    }

    @Test
    void decide_linksEarlierIncidentsOfSameToolAndTarget() {
        RecoveryDecision first = engine.decide("nuclei", ToolError.of("invalid json"),
                ToolInvocation.firstAttempt("a.example", null));
        engine.decide("nuclei", ToolError.of("invalid json"), ToolInvocation.firstAttempt("b.example", null));
        RecoveryDecision third = engine.decide("nuclei", ToolError.of("malformed output"),
                ToolInvocation.firstAttempt("a.example", null).nextAttempt());

        assertThat(first.incident().previousIncidents()).isEmpty();
        assertThat(third.incident().previousIncidents()).containsExactly(first.incident().id());
        assertThat(engine.ledger().size()).isEqualTo(3);
    }

    @Test
    void decide_keepsOnlyLatestLineageUpToLimit() {
        RecoveryEngine bounded = RecoveryEngine.builder()
                .settings(new RecoverySettings(1000, 0.9, 1000.0, Duration.ofHours(1), 10, 2))
                .sampler(ResourceSampler.disabled())
                .sink(escalations::add)
                .build();
        List<IncidentId> ids = new ArrayList<>();
        RecoveryDecision last = null;
        for (int i = 0; i < 4; i++) {
            last = bounded.decide("nuclei", ToolError.of("invalid json"), ToolInvocation.firstAttempt("a.example", null));
            ids.add(last.incident().id());
        }

        assertThat(last.incident().previousIncidents()).containsExactly(ids.get(1), ids.get(2));
        assertThat(bounded.ledger().lineage("nuclei", "a.example")).hasSize(4);
    }

    @Test
    void decide_unreadableWordlist_isPermissionDenied() {
        RecoveryDecision decision = engine.decide("gobuster",
                ToolError.of(new FileNotFoundException("/usr/share/wordlists/common.txt (Permission denied)")),
                ToolInvocation.firstAttempt("example.com", null));

        assertThat(decision.errorKind()).isEqualTo(ErrorKind.PERMISSION_DENIED);
        assertThat(decision.action()).isEqualTo(RecoveryAction.ESCALATE_TO_HUMAN);
    }

    @Test
    void handleFailure_throwable_usesExceptionTag() {
        RecoveryStrategy strategy = engine.handleFailure("ffuf",
                new SocketTimeoutException("permission denied while reading"),
                ToolInvocation.firstAttempt("example.com", null));

        assertThat(strategy.action()).isEqualTo(RecoveryAction.RETRY_WITH_REDUCED_SCOPE);
        assertThat(engine.ledger().snapshot().get(0).errorKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(engine.ledger().snapshot().get(0).stackTrace()).contains("SocketTimeoutException");
    }

    @Test
    void decide_failingSampler_recordsUnavailableResources() {
        RecoveryEngine fragile = RecoveryEngine.builder()
                .sampler(() -> {
                    throw new IllegalStateException("no /proc");
                })
                .sink(escalations::add)
                .build();

        RecoveryDecision decision = fragile.decide("nmap", ToolError.of("weird failure"), null);

        assertThat(decision.errorKind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(decision.incident().target()).isEqualTo(ToolInvocation.UNKNOWN_TARGET);
        assertThat(decision.incident().resources().available()).isFalse();
        assertThat(decision.incident().resources().unavailableReason()).contains("no /proc");
    }

    @Test
    void unknownFirstAttempt_escalatesWithMediumUrgency() {
        RecoveryDecision decision = engine.decide("nmap", ToolError.of("segfault in libpcap"),
                ToolInvocation.firstAttempt("10.0.0.5", null));

        // 0.9 - 0.3 beats 0.3 - 0.045
        assertThat(decision.action()).isEqualTo(RecoveryAction.ESCALATE_TO_HUMAN);
        assertThat(decision.escalation()).map(EscalationRecord::urgency).contains(Urgency.MEDIUM);
    }

    @Test
    void escalate_manualCall_deliversToSink() {
        RecoveryDecision decision = engine.decide("gobuster", ToolError.of("rate limit exceeded"),
                ToolInvocation.firstAttempt("example.com", null));

        EscalationRecord record = engine.escalate(decision.incident(), Urgency.LOW);

        assertThat(escalations).containsExactly(record);
        assertThat(record.suggestedActions()).contains("Wait before retrying");
    }

    @Test
    void getStatistics_summarizesLedger() {
        engine.handleFailure("nmap", ToolError.of("timed out"), ToolInvocation.firstAttempt("a", null));
        engine.handleFailure("gobuster", ToolError.of("429"), ToolInvocation.firstAttempt("b", null));
        engine.handleFailure("nmap", ToolError.of("access denied"), ToolInvocation.firstAttempt("a", null));

        LedgerStatistics statistics = engine.getStatistics();

        assertThat(statistics.total()).isEqualTo(3);
        assertThat(statistics.countsByTool()).containsEntry("nmap", 2L).containsEntry("gobuster", 1L);
        assertThat(statistics.countsByKind())
                .containsEntry("timeout", 1L)
                .containsEntry("rate_limited", 1L)
                .containsEntry("permission_denied", 1L);
        assertThat(statistics.recentCount()).isEqualTo(3);
    }

    @Test
    void settings_capLedgerCapacity() {
        RecoveryEngine small = RecoveryEngine.builder()
                .settings(RecoverySettings.defaults().withLedgerCapacity(2))
                .sampler(ResourceSampler.disabled())
                .sink(escalations::add)
                .build();

        for (int i = 0; i < 3; i++) {
            small.handleFailure("nmap", ToolError.of("timed out"), ToolInvocation.firstAttempt("a", null));
        }

        assertThat(small.getStatistics().total()).isEqualTo(2);
    }

    @Test
    void classify_doesNotRecord() {
        assertThat(engine.classify(ToolError.of("no space left on device"))).isEqualTo(ErrorKind.RESOURCE_EXHAUSTED);
        assertThat(engine.ledger().size()).isZero();
    }
}
