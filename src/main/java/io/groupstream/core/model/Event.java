package io.groupstream.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One record read from a group's derived log. Immutable once read.
 *
 * @param entityId      entity the event belongs to (the log key)
 * @param itemId        optional sub-item of the entity, {@code null} when absent
 * @param timestamp     log timestamp of the record
 * @param payload       raw JSON payload as read from the log
 * @param sequenceToken log position, see {@link SequenceToken}
 */
public record Event(String entityId,
                   String itemId,
                   Instant timestamp,
                   String payload,
                   long sequenceToken) {

    public Event {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(payload, "payload");
    }
}
