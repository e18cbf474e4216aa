package io.groupstream.grouping.impl;

import com.fasterxml.jackson.databind.JsonNode;
import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.core.error.ServiceUnavailableException;
import io.groupstream.grouping.type.GroupingStrategy;
import io.groupstream.metadata.KsqlClient;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Pattern;

import static io.groupstream.metadata.KsqlClient.escapeLiteral;

/**
 * Groups entities by one level of their UNS path (workcenter, area, line...),
 * read from the ksqlDB mapping table. Each group's derived log is a persistent
 * ksqlDB stream joining the enriched asset stream with the mapping table.
 */
@Slf4j
public final class UnsLevelGroupingStrategy implements GroupingStrategy {
    /* Group labels become part of unquoted ksql identifiers. */
    private static final Pattern IDENTIFIER_SAFE = Pattern.compile("[A-Za-z0-9_]+");

    private final KsqlClient ksql;
    private final ServiceConfig cfg;
    private final String level;

    public UnsLevelGroupingStrategy(final KsqlClient ksql, final ServiceConfig cfg) {
        this.ksql = ksql;
        this.cfg = cfg;
        this.level = escapeLiteral(cfg.getUnsGroupingLevel());
    }

    @Override
    public Optional<String> groupOf(final String entityId) {
        final String sql = "SELECT UNS_LEVELS['" + level + "'] AS GROUPS FROM " + cfg.getKsqldbUnsMap()
                + " WHERE ASSET_UUID = '" + escapeLiteral(entityId) + "';";
        return ksql.query(sql).stream()
                .map(row -> text(row, "GROUPS"))
                .filter(Objects::nonNull)
                .findFirst();
    }

    @Override
    public List<String> groups() {
        final String sql = "SELECT UNS_LEVELS['" + level + "'] AS GROUPS FROM " + cfg.getKsqldbUnsMap() + ";";
        return distinct(ksql.query(sql), row -> text(row, "GROUPS"));
    }

    @Override
    public List<String> entitiesIn(final String group) {
        final String sql = "SELECT ASSET_UUID FROM " + cfg.getKsqldbUnsMap()
                + " WHERE UNS_LEVELS['" + level + "'] = '" + escapeLiteral(group) + "';";
        return distinct(ksql.query(sql), row -> text(row, "ASSET_UUID"));
    }

    @Override
    public void createDerivedLog(final String group) {
        final String stream = cfg.derivedLogName(requireIdentifierSafe(group));
        final String sql = "CREATE STREAM IF NOT EXISTS " + stream
                + " WITH (KAFKA_TOPIC='" + cfg.derivedLogTopic(group) + "', VALUE_FORMAT='JSON') AS"
                + " SELECT s.* FROM " + cfg.getKsqldbAssetsStream() + " s"
                + " JOIN " + cfg.getKsqldbUnsMap() + " h ON s.asset_uuid = h.asset_uuid"
                + " WHERE h.uns_levels['" + level + "'] = '" + escapeLiteral(group) + "';";
        log.info("Creating derived log {} for group [{}]", stream, group);
        log.debug(sql);
        ksql.statement(sql);
    }

    @Override
    public void removeDerivedLog(final String group) {
        final String sql = "DROP STREAM " + cfg.derivedLogName(requireIdentifierSafe(group)) + " DELETE TOPIC;";
        log.info("Removing derived log: {}", sql);
        ksql.statement(sql);
    }

    @Override
    public String readinessIssue() {
        try {
            final String expected = cfg.getKsqldbUnsMap().toUpperCase(Locale.ROOT);
            final boolean found = ksql.tables().stream()
                    .anyMatch(t -> t.toUpperCase(Locale.ROOT).equals(expected));
            return found ? null : "UNS mapping table '" + cfg.getKsqldbUnsMap() + "' not found in ksqlDB";
        } catch (final ServiceUnavailableException e) {
            return "ksqlDB connection failed: " + e.getMessage();
        }
    }

    private static String requireIdentifierSafe(final String group) {
        if (!IDENTIFIER_SAFE.matcher(group).matches()) {
            throw new IllegalArgumentException("Group label '" + group + "' cannot name a ksqlDB stream");
        }
        return group;
    }

    private static String text(final Map<String, JsonNode> row, final String column) {
        final JsonNode v = row.get(column);
        return v == null || v.isNull() || v.asText().isEmpty() ? null : v.asText();
    }

    private static List<String> distinct(final List<Map<String, JsonNode>> rows,
                                         final Function<Map<String, JsonNode>, String> column) {
        final TreeSet<String> out = new TreeSet<>();
        for (final Map<String, JsonNode> row : rows) {
            final String v = column.apply(row);
            if (v != null) out.add(v);
        }
        return List.copyOf(out);
    }
}
