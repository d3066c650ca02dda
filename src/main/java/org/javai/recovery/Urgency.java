package org.javai.recovery;

import java.util.Locale;

/**
 * How quickly a human should look at an escalated failure.
 */
public enum Urgency {
    /**
     * Can wait for the next working session (e.g. a tool needs installing).
     */
    LOW,

    /**
     * Needs attention soon but the campaign can continue elsewhere.
     */
    MEDIUM,

    /**
     * Autonomous recovery is exhausted or credentials are required.
     */
    HIGH;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses an urgency label, falling back to {@link #MEDIUM} for null or unrecognised input.
     */
    public static Urgency parse(Object label) {
        if (label == null) {
            return MEDIUM;
        }
        String normalized = label.toString().trim().toUpperCase(Locale.ROOT);
        for (Urgency urgency : values()) {
            if (urgency.name().equals(normalized)) {
                return urgency;
            }
        }
        return MEDIUM;
    }
}
