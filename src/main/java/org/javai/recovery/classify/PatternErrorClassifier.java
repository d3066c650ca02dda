package org.javai.recovery.classify;

import org.javai.recovery.ErrorKind;
import org.javai.recovery.ExceptionKind;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Classifies tool failures from their exception tag and error text.
 *
 * <p>An exception tag wins over the text. Otherwise the lower-cased message is
 * tested against the rule table in declared order and the first matching rule
 * decides. A message matching several categories therefore resolves to the
 * earliest rule, e.g. "host not found" is {@link ErrorKind#TOOL_NOT_FOUND}
 * because the generic "not found" rule is declared before the DNS rule.
 */
public class PatternErrorClassifier implements ErrorClassifier {

    /**
     * The default rule table, in tie-break order.
     */
    public static final List<PatternRule> DEFAULT_RULES = List.of(
            PatternRule.of("timeout|timed out|connection timeout|read timeout", ErrorKind.TIMEOUT),
            PatternRule.of("operation timed out|command timeout", ErrorKind.TIMEOUT),

            PatternRule.of("permission denied|access denied|forbidden|not authorized", ErrorKind.PERMISSION_DENIED),
            PatternRule.of("sudo required|root required|insufficient privileges", ErrorKind.PERMISSION_DENIED),

            PatternRule.of("network unreachable|host unreachable|no route to host", ErrorKind.NETWORK_UNREACHABLE),
            PatternRule.of("connection refused|connection reset|network error", ErrorKind.NETWORK_UNREACHABLE),

            PatternRule.of("rate limit|too many requests|throttled|429", ErrorKind.RATE_LIMITED),
            PatternRule.of("request limit exceeded|quota exceeded", ErrorKind.RATE_LIMITED),

            PatternRule.of("command not found|no such file or directory|not found", ErrorKind.TOOL_NOT_FOUND),
            PatternRule.of("executable not found|binary not found", ErrorKind.TOOL_NOT_FOUND),

            PatternRule.of("invalid argument|invalid option|unknown option", ErrorKind.INVALID_PARAMETERS),
            PatternRule.of("bad parameter|invalid parameter|syntax error", ErrorKind.INVALID_PARAMETERS),

            PatternRule.of("out of memory|memory error|disk full|no space left", ErrorKind.RESOURCE_EXHAUSTED),
            PatternRule.of("resource temporarily unavailable|too many open files", ErrorKind.RESOURCE_EXHAUSTED),

            PatternRule.of("authentication failed|login failed|invalid credentials", ErrorKind.AUTHENTICATION_FAILED),
            PatternRule.of("unauthorized|invalid token|expired token", ErrorKind.AUTHENTICATION_FAILED),

            PatternRule.of("target unreachable|target not responding|target down", ErrorKind.TARGET_UNREACHABLE),
            PatternRule.of("host not found|dns resolution failed", ErrorKind.TARGET_UNREACHABLE),

            PatternRule.of("parse error|parsing failed|invalid format|malformed", ErrorKind.PARSING_ERROR),
            PatternRule.of("json decode error|xml parse error|invalid json", ErrorKind.PARSING_ERROR)
    );

    private final List<PatternRule> rules;

    public PatternErrorClassifier() {
        this(DEFAULT_RULES);
    }

    /**
     * Creates a classifier over a custom rule table.
     *
     * @param rules the rules in tie-break order (must not be empty)
     */
    public PatternErrorClassifier(List<PatternRule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("rules must not be empty");
        }
        this.rules = List.copyOf(rules);
    }

    @Override
    public ErrorKind classify(String message, ExceptionKind kindTag) {
        if (kindTag != null) {
            return kindFor(kindTag);
        }
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
        return rules.stream()
                .filter(rule -> rule.matches(text))
                .map(PatternRule::kind)
                .findFirst()
                .orElse(ErrorKind.UNKNOWN);
    }

    public List<PatternRule> rules() {
        return rules;
    }

    private static ErrorKind kindFor(ExceptionKind tag) {
        return switch (tag) {
            case TIMEOUT -> ErrorKind.TIMEOUT;
            case PERMISSION -> ErrorKind.PERMISSION_DENIED;
            case CONNECTIVITY -> ErrorKind.NETWORK_UNREACHABLE;
            case NOT_FOUND -> ErrorKind.TOOL_NOT_FOUND;
        };
    }
}
