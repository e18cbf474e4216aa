package io.groupstream.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.groupstream.core.error.ServiceUnavailableException;
import io.groupstream.transport.client.HttpJsonClient;
import io.groupstream.transport.client.HttpResult;
import io.groupstream.transport.codec.EventCodec;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking client for the ksqlDB REST API: pull queries on {@code /query} and
 * statements on {@code /ksql}. Rows come back keyed by upper-case column name.
 */
@Slf4j
public class KsqlClient {
    private final HttpJsonClient http;
    private final String baseUrl;
    private final Duration timeout;

    public KsqlClient(final HttpJsonClient http, final String baseUrl, final Duration timeout) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
    }

    /** Escapes single quotes for use inside a ksql string literal. */
    public static String escapeLiteral(final String value) {
        return value.replace("'", "''");
    }

    /**
     * Runs a pull query.
     *
     * @throws ServiceUnavailableException when ksqlDB cannot be reached or fails
     * @throws KsqlStatementException      when ksqlDB rejects the query
     */
    public List<Map<String, JsonNode>> query(final String sql) {
        final JsonNode body = send("/query", sql);
        final List<Map<String, JsonNode>> rows = new ArrayList<>();
        List<String> columns = List.of();

        for (final JsonNode element : body) {
            if (element.has("header")) {
                columns = parseSchema(element.path("header").path("schema").asText(""));
            } else if (element.has("row")) {
                final JsonNode values = element.path("row").path("columns");
                final Map<String, JsonNode> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size() && i < values.size(); i++) {
                    row.put(columns.get(i), values.get(i));
                }
                rows.add(row);
            }
        }
        return rows;
    }

    /** Executes a DDL statement such as {@code CREATE STREAM} or {@code DROP STREAM}. */
    public void statement(final String sql) {
        send("/ksql", sql);
    }

    /** Names of all tables known to ksqlDB. */
    public List<String> tables() {
        final JsonNode body = send("/ksql", "SHOW TABLES;");
        final List<String> names = new ArrayList<>();
        for (final JsonNode element : body) {
            for (final JsonNode t : element.path("tables")) {
                names.add(t.path("name").asText());
            }
        }
        return names;
    }

    private JsonNode send(final String path, final String sql) {
        final ObjectNode req = EventCodec.MAPPER.createObjectNode();
        req.put("ksql", sql.strip());
        req.putObject("streamsProperties");

        final HttpResult res;
        try {
            res = http.post(baseUrl + path, req.toString(), timeout).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while calling ksqlDB", e);
        } catch (final ExecutionException | TimeoutException e) {
            final Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
            throw new ServiceUnavailableException("ksqlDB unreachable at " + baseUrl + ": " + cause, cause);
        }

        if (res.status() >= 500) {
            throw new ServiceUnavailableException("ksqlDB returned " + res.status() + ": " + res.body());
        }
        if (!res.isSuccess()) {
            throw new KsqlStatementException("ksqlDB rejected [" + sql.strip() + "]: " + res.body());
        }
        try {
            return EventCodec.MAPPER.readTree(res.body());
        } catch (final JsonProcessingException e) {
            throw new ServiceUnavailableException("Malformed ksqlDB response: " + e.getOriginalMessage(), e);
        }
    }

    /* "`A` STRING, `B` MAP<STRING, STRING>" -> [A, B] */
    static List<String> parseSchema(final String schema) {
        final List<String> names = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i <= schema.length(); i++) {
            final char c = i < schema.length() ? schema.charAt(i) : ',';
            if (c == '<') depth++;
            else if (c == '>') depth--;
            else if (c == ',' && depth == 0) {
                final String col = schema.substring(start, i).strip();
                start = i + 1;
                if (col.isEmpty()) continue;
                final int open = col.indexOf('`');
                final int close = open < 0 ? -1 : col.indexOf('`', open + 1);
                final String name = close > open
                        ? col.substring(open + 1, close)
                        : col.split("\\s+")[0];
                names.add(name.toUpperCase(Locale.ROOT));
            }
        }
        return names;
    }
}
