package org.javai.recovery.ledger;

import org.javai.recovery.ErrorKind;

import java.time.Instant;
import java.util.Objects;

/**
 * The short form of an incident listed in statistics.
 *
 * @param tool The tool that failed
 * @param errorKind The classified kind
 * @param occurredAt When the failure was recorded
 */
public record RecentIncident(String tool, ErrorKind errorKind, Instant occurredAt) {

    public RecentIncident {
        Objects.requireNonNull(tool, "tool must not be null");
        Objects.requireNonNull(errorKind, "errorKind must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }
}
