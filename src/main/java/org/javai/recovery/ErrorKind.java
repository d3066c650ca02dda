package org.javai.recovery;

import java.util.Locale;
import java.util.Objects;

/**
 * The closed set of failure categories a tool failure is classified into.
 * Exactly one kind is assigned to every incident.
 */
public enum ErrorKind {
    /**
     * The tool or the target did not answer in time.
     */
    TIMEOUT("timeout"),

    /**
     * The tool lacks the privileges it needs (raw sockets, protected files).
     */
    PERMISSION_DENIED("permission_denied"),

    /**
     * The local network path is broken: refused, reset or unroutable.
     */
    NETWORK_UNREACHABLE("network_unreachable"),

    /**
     * The target or an upstream API is throttling requests.
     */
    RATE_LIMITED("rate_limited"),

    /**
     * The tool binary is missing from the host.
     */
    TOOL_NOT_FOUND("tool_not_found"),

    /**
     * The tool rejected its arguments.
     */
    INVALID_PARAMETERS("invalid_parameters"),

    /**
     * The host ran out of memory, disk or file handles.
     */
    RESOURCE_EXHAUSTED("resource_exhausted"),

    /**
     * Credentials or tokens were rejected.
     */
    AUTHENTICATION_FAILED("authentication_failed"),

    /**
     * The target itself is down or cannot be resolved.
     */
    TARGET_UNREACHABLE("target_unreachable"),

    /**
     * Tool output could not be parsed.
     */
    PARSING_ERROR("parsing_error"),

    /**
     * No known pattern matched.
     */
    UNKNOWN("unknown");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    /**
     * The stable lower-case name used in records and statistics.
     */
    public String value() {
        return value;
    }

    /**
     * Resolves a kind from its stable name, ignoring case.
     *
     * @throws IllegalArgumentException if no kind has that name
     */
    public static ErrorKind fromValue(String value) {
        Objects.requireNonNull(value, "value must not be null");
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ErrorKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown error kind: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
