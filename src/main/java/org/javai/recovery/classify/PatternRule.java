package org.javai.recovery.classify;

import org.javai.recovery.ErrorKind;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One row of the classification table: a regular expression searched in the
 * lower-cased error text, and the kind it maps to.
 *
 * @param pattern The compiled, case-insensitive pattern
 * @param kind The kind assigned on a match
 */
public record PatternRule(Pattern pattern, ErrorKind kind) {

    public PatternRule {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static PatternRule of(String regex, ErrorKind kind) {
        return new PatternRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), kind);
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
