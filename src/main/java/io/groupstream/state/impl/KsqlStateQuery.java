package io.groupstream.state.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.groupstream.metadata.KsqlClient;
import io.groupstream.state.StateQuery;
import io.groupstream.transport.codec.EventCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static io.groupstream.metadata.KsqlClient.escapeLiteral;

/**
 * Reads the assets table, keyed {@code asset_uuid|id}.
 */
@Slf4j
@RequiredArgsConstructor
public final class KsqlStateQuery implements StateQuery {
    private static final String[] ITEM_COLUMNS = {"ID", "VALUE", "TYPE", "TAG", "TIMESTAMP"};

    private final KsqlClient ksql;
    private final String assetsTable;

    @Override
    public Optional<JsonNode> stateOf(final String entityId, final String itemId) {
        final String entity = escapeLiteral(entityId);
        if (itemId != null) {
            final String key = entity + "|" + escapeLiteral(itemId);
            final List<Map<String, JsonNode>> rows = ksql.query(
                    "SELECT asset_uuid, id, value, type, tag, timestamp FROM " + assetsTable
                            + " WHERE key = '" + key + "' LIMIT 1;");
            if (rows.isEmpty()) {
                log.info("No state for {} item {}", entityId, itemId);
                return Optional.empty();
            }
            final ObjectNode out = EventCodec.MAPPER.createObjectNode();
            copy(rows.get(0), "ASSET_UUID", out, "asset_uuid");
            item(rows.get(0), out);
            return Optional.of(out);
        }

        final List<Map<String, JsonNode>> rows = ksql.query(
                "SELECT asset_uuid, id, value, type, tag, timestamp FROM " + assetsTable
                        + " WHERE asset_uuid = '" + entity + "';");
        if (rows.isEmpty()) {
            log.info("No state for {}", entityId);
            return Optional.empty();
        }
        final ObjectNode out = EventCodec.MAPPER.createObjectNode();
        out.put("asset_uuid", entityId);
        final ArrayNode items = out.putArray("dataItems");
        for (final Map<String, JsonNode> row : rows) {
            item(row, items.addObject());
        }
        return Optional.of(out);
    }

    private static void item(final Map<String, JsonNode> row, final ObjectNode target) {
        for (final String col : ITEM_COLUMNS) {
            copy(row, col, target, col.toLowerCase(Locale.ROOT));
        }
    }

    private static void copy(final Map<String, JsonNode> row, final String column,
                             final ObjectNode target, final String field) {
        final JsonNode v = row.get(column);
        target.set(field, v == null ? EventCodec.MAPPER.nullNode() : v);
    }
}
