package io.groupstream.state;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Point-in-time state of an entity from the materialized-state service.
 */
public interface StateQuery {

    /**
     * With {@code itemId}: one record. Without: {@code {asset_uuid, dataItems: [...]}}.
     *
     * @return empty when nothing matches
     * @throws io.groupstream.core.error.ServiceUnavailableException when the service is unreachable
     */
    Optional<JsonNode> stateOf(String entityId, String itemId);
}
