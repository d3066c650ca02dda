package org.javai.recovery;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.recovery.adjust.ParameterAdjuster;
import org.javai.recovery.classify.ErrorClassifier;
import org.javai.recovery.classify.PatternErrorClassifier;
import org.javai.recovery.escalate.EscalationRecord;
import org.javai.recovery.escalate.EscalationReporter;
import org.javai.recovery.escalate.EscalationSink;
import org.javai.recovery.escalate.Log4jEscalationSink;
import org.javai.recovery.ledger.IncidentLedger;
import org.javai.recovery.ledger.LedgerStatistics;
import org.javai.recovery.resources.ResourceSampler;
import org.javai.recovery.resources.ResourceSnapshot;
import org.javai.recovery.strategy.RecoveryCatalog;
import org.javai.recovery.strategy.StrategySelector;
import org.javai.recovery.substitute.SubstitutionConstraint;
import org.javai.recovery.substitute.ToolSubstitutionDirectory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for recovering from failed tool runs.
 *
 * <p>On each failure the engine classifies the error, records the incident in
 * the ledger together with a resource snapshot and references to the latest
 * earlier incidents of the same tool and target (at most the lineage limit),
 * and selects the next recovery
 * strategy. When that strategy is an escalation the engine reports it to the
 * configured sink straight away.
 *
 * <p>The engine itself holds no mutable state besides the ledger and is safe
 * to share between threads.
 *
 * <pre>{@code
 * RecoveryEngine engine = RecoveryEngine.builder()
 *     .settings(RecoverySettings.fromEnvironment())
 *     .sink(EscalationSink.composite(new Log4jEscalationSink(), new JsonLinesEscalationSink()))
 *     .build();
 *
 * RecoveryStrategy next = engine.handleFailure("nmap", ToolError.of(stderr), invocation);
 * }</pre>
 */
public class RecoveryEngine {

    private static final Logger LOGGER = LogManager.getLogger(RecoveryEngine.class);
    private static final Marker RECOVERY_MARKER = MarkerManager.getMarker("RECOVERY");

    private final ErrorClassifier classifier;
    private final RecoveryCatalog catalog;
    private final StrategySelector selector;
    private final ParameterAdjuster adjuster;
    private final ToolSubstitutionDirectory directory;
    private final IncidentLedger ledger;
    private final ResourceSampler sampler;
    private final EscalationReporter reporter;
    private final Clock clock;
    private final int lineageLimit;

    private RecoveryEngine(Builder builder) {
        RecoverySettings settings = builder.settings;
        this.clock = builder.clock;
        this.lineageLimit = settings.lineageLimit();
        this.classifier = builder.classifier != null ? builder.classifier : new PatternErrorClassifier();
        this.catalog = builder.catalog != null ? builder.catalog : new RecoveryCatalog();
        this.selector = builder.selector != null ? builder.selector : new StrategySelector(settings);
        this.adjuster = builder.adjuster != null ? builder.adjuster : new ParameterAdjuster();
        this.directory = builder.directory != null ? builder.directory : new ToolSubstitutionDirectory();
        this.ledger = builder.ledger != null ? builder.ledger : new IncidentLedger(settings, clock);
        this.sampler = builder.sampler != null ? builder.sampler : ResourceSampler.system();
        EscalationSink sink = builder.sink != null ? builder.sink : new Log4jEscalationSink();
        this.reporter = new EscalationReporter(ledger, sink, lineageLimit);
    }

    /**
     * Creates an engine with every collaborator at its default.
     */
    public static RecoveryEngine create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // === Failure handling ===

    /**
     * Handles a failed tool run and returns the strategy to apply next.
     *
     * @param tool the tool that failed
     * @param error the raw failure
     * @param invocation target, parameters and attempt number of the failed run
     * @return the next strategy; never null
     */
    public RecoveryStrategy handleFailure(String tool, ToolError error, ToolInvocation invocation) {
        return decide(tool, error, invocation).strategy();
    }

    /**
     * Handles a failed tool run that surfaced as an exception.
     */
    public RecoveryStrategy handleFailure(String tool, Throwable failure, ToolInvocation invocation) {
        return handleFailure(tool, ToolError.of(failure), invocation);
    }

    /**
     * Handles a failed tool run and returns the full decision, including the
     * recorded incident and any escalation delivered.
     *
     * @param tool the tool that failed
     * @param error the raw failure (null reads as an empty message)
     * @param invocation the failed run (null reads as a first attempt against an unknown target)
     * @return the decision; never null
     */
    public RecoveryDecision decide(String tool, ToolError error, ToolInvocation invocation) {
        Objects.requireNonNull(tool, "tool must not be null");
        ToolError raw = error != null ? error : ToolError.of("");
        ToolInvocation run = invocation != null ? invocation : ToolInvocation.firstAttempt(null, null);

        ErrorKind kind = classifier.classify(raw.message(), raw.kindTag());
        FailureContext incident = FailureContext.builder(tool, kind)
                .target(run.target())
                .parameters(run.parameters())
                .errorMessage(raw.message())
                .attemptCount(run.attemptCount())
                .occurredAt(clock.instant())
                .stackTrace(raw.stackTrace())
                .resources(sampleResources())
                .previousIncidents(ledger.lineage(tool, run.target(), lineageLimit))
                .build();
        ledger.append(incident);

        RecoveryStrategy strategy = selector.select(catalog.strategiesFor(kind), incident);
        LOGGER.atWarn()
                .withMarker(RECOVERY_MARKER)
                .log("{} - Applying {} for {} on {} (attempt {})",
                        kind.value(), strategy.action().value(), tool, run.target(), run.attemptCount());

        Optional<EscalationRecord> escalation = Optional.empty();
        if (strategy.action() == RecoveryAction.ESCALATE_TO_HUMAN) {
            escalation = Optional.of(reporter.escalate(incident, strategy.urgency()));
        }
        return new RecoveryDecision(incident, strategy, escalation);
    }

    /**
     * Classifies a raw failure without recording it.
     */
    public ErrorKind classify(ToolError error) {
        ToolError raw = error != null ? error : ToolError.of("");
        return classifier.classify(raw.message(), raw.kindTag());
    }

    // === Parameter adjustment and substitution ===

    /**
     * Returns a new parameter map adjusted to work around the failure kind.
     * The given map is not modified.
     */
    public Map<String, String> adjustParameters(String tool, ErrorKind kind, Map<String, String> parameters) {
        Map<String, String> adjusted = adjuster.adjust(tool, kind, parameters);
        LOGGER.info("Adjusted parameters for {} after {}: {} -> {}",
                tool, kind, parameters == null ? Map.of() : parameters, adjusted);
        return adjusted;
    }

    /**
     * The best substitute for a tool under the given constraints.
     */
    public Optional<String> getAlternative(String tool, Set<SubstitutionConstraint> constraints) {
        return directory.bestAlternative(tool, constraints);
    }

    /**
     * The best substitute for a tool under the constraints a switch strategy asks for.
     */
    public Optional<String> getAlternative(String tool, RecoveryStrategy strategy) {
        return getAlternative(tool, SubstitutionConstraint.fromStrategy(strategy));
    }

    // === Escalation and monitoring ===

    /**
     * Escalates a recorded failure to humans, independent of any strategy.
     */
    public EscalationRecord escalate(FailureContext context, Urgency urgency) {
        return reporter.escalate(context, urgency);
    }

    public LedgerStatistics getStatistics() {
        return ledger.statistics();
    }

    public IncidentLedger ledger() {
        return ledger;
    }

    private ResourceSnapshot sampleResources() {
        try {
            ResourceSnapshot snapshot = sampler.sample();
            return snapshot != null ? snapshot : ResourceSnapshot.unavailable("resource sampler returned nothing");
        } catch (RuntimeException e) {
            LOGGER.debug("Resource sampling failed: {}", e.toString());
            return ResourceSnapshot.unavailable("Unable to get system resources: " + e.getMessage());
        }
    }

    /**
     * Assembles an engine. Every collaborator left unset gets its default;
     * defaults that depend on settings (ledger capacity, selector weights,
     * lineage limit) read them from {@link #settings(RecoverySettings)}.
     */
    public static class Builder {
        private RecoverySettings settings = RecoverySettings.defaults();
        private Clock clock = Clock.systemUTC();
        private ErrorClassifier classifier;
        private RecoveryCatalog catalog;
        private StrategySelector selector;
        private ParameterAdjuster adjuster;
        private ToolSubstitutionDirectory directory;
        private IncidentLedger ledger;
        private ResourceSampler sampler;
        private EscalationSink sink;

        private Builder() {}

        public Builder settings(RecoverySettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder catalog(RecoveryCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder selector(StrategySelector selector) {
            this.selector = selector;
            return this;
        }

        public Builder adjuster(ParameterAdjuster adjuster) {
            this.adjuster = adjuster;
            return this;
        }

        public Builder directory(ToolSubstitutionDirectory directory) {
            this.directory = directory;
            return this;
        }

        public Builder ledger(IncidentLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder sampler(ResourceSampler sampler) {
            this.sampler = sampler;
            return this;
        }

        public Builder sink(EscalationSink sink) {
            this.sink = sink;
            return this;
        }

        public RecoveryEngine build() {
            return new RecoveryEngine(this);
        }
    }
}
