package io.groupstream.session;

import io.groupstream.core.model.Event;

import java.util.Objects;

/**
 * Delivery filter of a session: the entity must match, and the item too when set.
 *
 * @param entityId required entity identifier
 * @param itemId   optional sub-item identifier, {@code null} matches every item
 */
public record SessionFilter(String entityId, String itemId) {

    public SessionFilter {
        Objects.requireNonNull(entityId, "entityId");
        if (itemId != null && itemId.isBlank()) {
            itemId = null;
        }
    }

    public static SessionFilter entity(final String entityId) {
        return new SessionFilter(entityId, null);
    }

    public boolean matches(final Event event) {
        if (!entityId.equals(event.entityId())) return false;
        return itemId == null || itemId.equals(event.itemId());
    }
}
