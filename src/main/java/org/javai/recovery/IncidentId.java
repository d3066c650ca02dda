package org.javai.recovery;

import java.util.Objects;
import java.util.UUID;

/**
 * Stable identifier of one recorded incident.
 * Incidents refer to their predecessors through these identifiers, never by embedding them.
 *
 * @param value The identifier text
 */
public record IncidentId(String value) {

    public IncidentId {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    public static IncidentId random() {
        return new IncidentId(UUID.randomUUID().toString());
    }

    public static IncidentId of(String value) {
        return new IncidentId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
