package io.groupstream.transport.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.groupstream.core.model.Event;
import io.groupstream.core.model.SequenceToken;

import java.time.Instant;

/**
 * JSON shapes of events: decoding log records and encoding stream lines.
 */
public final class EventCodec {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String[] ENTITY_FIELDS = {"asset_uuid", "ASSET_UUID"};
    private static final String[] ITEM_FIELDS = {"id", "ID"};

    private EventCodec() {
    }

    /**
     * Builds an event from a log record. The key carries the entity; when it is
     * absent the entity is read from the payload.
     *
     * @return the event, or {@code null} when no entity can be determined
     */
    public static Event fromLogRecord(final String key,
                                      final String value,
                                      final long timestampMillis,
                                      final long sequenceToken) {
        if (value == null) return null;

        JsonNode node = null;
        try {
            node = MAPPER.readTree(value);
        } catch (final JsonProcessingException ignored) {
            // opaque payload: only the key can identify it
        }

        String entity = key;
        if ((entity == null || entity.isEmpty()) && node != null) {
            entity = firstText(node, ENTITY_FIELDS);
        }
        if (entity == null || entity.isEmpty()) return null;

        final String item = node == null ? null : firstText(node, ITEM_FIELDS);
        final Instant ts = timestampMillis >= 0 ? Instant.ofEpochMilli(timestampMillis) : Instant.now();
        return new Event(entity, item, ts, value, sequenceToken);
    }

    /** One newline-terminated JSON object per event. */
    public static String toJsonLine(final Event e) {
        final ObjectNode out = MAPPER.createObjectNode();
        out.put("asset_uuid", e.entityId());
        if (e.itemId() != null) out.put("id", e.itemId());
        out.put("timestamp", e.timestamp().toString());
        out.put("sequence_token", SequenceToken.format(e.sequenceToken()));
        try {
            out.set("payload", MAPPER.readTree(e.payload()));
        } catch (final JsonProcessingException notJson) {
            out.put("payload", e.payload());
        }
        return out.toString() + "\n";
    }

    private static String firstText(final JsonNode node, final String[] fields) {
        for (final String f : fields) {
            final JsonNode v = node.get(f);
            if (v != null && !v.isNull()) return v.asText();
        }
        return null;
    }
}
